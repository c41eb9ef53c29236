package com.pmr.collab.service;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Slf4j
public class ListenerRegistry {
    private final List<CollaborationListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean closed;

    public Subscription add(CollaborationListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void fire(Consumer<CollaborationListener> callback) {
        if (closed) {
            return;
        }
        for (CollaborationListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                log.error("Collaboration listener {} failed", listener, e);
            }
        }
    }

    /** After this no callback is delivered again. */
    public void close() {
        closed = true;
        listeners.clear();
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }
}
