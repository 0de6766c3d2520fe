package com.finchat.rag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FinChatRagApplication {
    public static void main(String[] args) {
        SpringApplication.run(FinChatRagApplication.class, args);
    }
}
