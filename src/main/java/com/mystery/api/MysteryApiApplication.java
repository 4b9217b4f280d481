package com.mystery.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application serving the mansion mystery game
 */
@SpringBootApplication(scanBasePackages = "com.mystery")
public class MysteryApiApplication {
    private static final Logger logger = LoggerFactory.getLogger(MysteryApiApplication.class);

    public static void main(String[] args) {
        logger.info("=== Mansion Mystery API Server ===");
        SpringApplication.run(MysteryApiApplication.class, args);
    }
}
