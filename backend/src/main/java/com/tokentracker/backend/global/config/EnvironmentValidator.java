package com.tokentracker.backend.global.config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or still hold shipped placeholders.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_JWT_SECRET = "dev-jwt-secret-change-me-before-deploying-0000";
    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String property : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(property);
            if (value == null || value.isBlank()) {
                problems.add(property + ": missing");
            }
        }

        boolean testProfile = Arrays.asList(environment.getActiveProfiles()).contains("test");
        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        if (!testProfile && jwtSecret.filter(PLACEHOLDER_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the placeholder with a random value");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                if (expiration < 60_000 || expiration > 86_400_000) {
                    problems.add("jwt.expiration: must be between 60000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join(", ", problems));
        }

        log.info("Environment validation passed");
    }
}
