package com.sheroshayari.auth;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * AuthServiceApplication - Main entry point for the SheroShayari auth service.
 *
 * Registration, email confirmation, login with JWT bearer tokens and the
 * forgot/reset password flow, backed by SQLite through Spring Data JPA.
 *
 * The default in-memory user store is excluded: all authentication is done
 * with bearer tokens validated by {@link com.sheroshayari.auth.web.JwtAuthenticationFilter}.
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@ConfigurationPropertiesScan
public class AuthServiceApplication {

    /**
     * Application entry point.
     *
     * @param args Command-line arguments (supports standard Spring Boot args)
     */
    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
    }
}
