package com.pmr.collab;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CollaborationClientApplication {

    public static void main(String[] args) {
        SpringApplication.run(CollaborationClientApplication.class, args);
    }
}
