package com.pmr.collab.transport;

import com.pmr.collab.exception.AuthenticationException;
import com.pmr.collab.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * {@link Transport} on top of Spring's {@link WebSocketClient}.
 */
@Slf4j
public class SpringWebSocketTransport implements Transport {
    private static final int SEND_TIME_LIMIT_MS = 5000;
    private static final int SEND_BUFFER_LIMIT = 512 * 1024;
    private static final Pattern AUTH_STATUS = Pattern.compile("\\b(401|403)\\b");

    private final WebSocketClient client;

    public SpringWebSocketTransport(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public void connect(URI endpoint, String accessToken, TransportListener listener) {
        URI uri = withToken(endpoint, accessToken);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken);

        log.debug("Connecting to {}", endpoint);
        client.execute(new Handler(listener), headers, uri)
                .whenComplete((session, error) -> {
                    if (error != null) {
                        listener.onConnectFailed(translate(error));
                    }
                });
    }

    /**
     * Appends the token as a query parameter. The endpoint is already encoded and kept as is;
     * the token is encoded strictly so that reserved characters survive.
     */
    static URI withToken(URI endpoint, String accessToken) {
        return UriComponentsBuilder.fromUri(endpoint)
                .queryParam("token", UriUtils.encode(accessToken, StandardCharsets.UTF_8))
                .build(true)
                .toUri();
    }

    static RuntimeException translate(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            String message = cause.getMessage();
            if (message != null && AUTH_STATUS.matcher(message).find()) {
                return new AuthenticationException("Handshake rejected: " + message, error);
            }
        }
        return new ConnectionException("Cannot connect: " + error.getMessage(), error);
    }

    private static final class Handler extends TextWebSocketHandler {
        private final TransportListener listener;

        private Handler(TransportListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            WebSocketSession decorated =
                    new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, SEND_BUFFER_LIMIT);
            listener.onOpen(new SpringConnection(decorated));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            listener.onMessage(message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            listener.onClose(status.getCode(), status.getReason());
        }
    }

    private static final class SpringConnection implements TransportConnection {
        private final WebSocketSession session;

        private SpringConnection(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public void send(String frame) {
            try {
                session.sendMessage(new TextMessage(frame));
            } catch (IOException | IllegalStateException | SessionLimitExceededException e) {
                throw new ConnectionException("Failed to send frame", e);
            }
        }

        @Override
        public void close(int code, String reason) {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(new CloseStatus(code, reason));
            } catch (IOException e) {
                log.debug("Error while closing WebSocket session {}", session.getId(), e);
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }
    }
}
