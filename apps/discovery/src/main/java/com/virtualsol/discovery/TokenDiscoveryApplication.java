package com.virtualsol.discovery;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Token Discovery Worker
 * Streams token launches, tracks lifecycle state and flushes buffered writes
 */
@SpringBootApplication
@EnableScheduling
public class TokenDiscoveryApplication {

    private static final Logger logger = LoggerFactory.getLogger(TokenDiscoveryApplication.class);

    public static void main(String[] args) {
        logger.info("Starting Token Discovery Worker...");
        SpringApplication.run(TokenDiscoveryApplication.class, args);
        logger.info("Token Discovery Worker started successfully!");
    }
}
