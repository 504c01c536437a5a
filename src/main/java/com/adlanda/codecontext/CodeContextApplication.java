package com.adlanda.codecontext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Code Context Service - Main Application
 *
 * Gives an AI assistant knowledge of a user's uploaded project: files are split
 * into fragments, fragments are embedded, and each chat message is enriched with
 * the most relevant fragments before it reaches the language model.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI, with per-request credentials
 * - Spring Data JPA for file and fragment storage
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class CodeContextApplication {

    public static void main(String[] args) {
        SpringApplication.run(CodeContextApplication.class, args);
    }
}
