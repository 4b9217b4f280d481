package com.mystery.api;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Entities and repositories live outside the application package
 */
@Configuration
@EntityScan(basePackages = "com.mystery.entity")
@EnableJpaRepositories(basePackages = "com.mystery.repository")
public class JpaConfig {
}
