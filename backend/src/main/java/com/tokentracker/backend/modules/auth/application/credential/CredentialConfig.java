package com.tokentracker.backend.modules.auth.application.credential;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
public class CredentialConfig {

    @Bean
    public PasswordEncoder passwordEncoder(@Value("${app.credentials.bcrypt-strength:10}") int strength) {
        return new BCryptPasswordEncoder(strength);
    }

    @Bean
    public BcryptCredentialScheme bcryptCredentialScheme(PasswordEncoder passwordEncoder) {
        return new BcryptCredentialScheme(passwordEncoder);
    }

    @Bean
    public CredentialEncoder credentialEncoder(BcryptCredentialScheme bcryptCredentialScheme) {
        return new CredentialEncoder(bcryptCredentialScheme);
    }

    @Bean
    public CredentialVerifier credentialVerifier(BcryptCredentialScheme bcryptCredentialScheme) {
        // order matters: the first scheme is the one new credentials are written with
        return new CredentialVerifier(List.of(
                bcryptCredentialScheme,
                new LegacyBase64CredentialScheme()
        ));
    }

    /**
     * Workers for BCrypt work so slow hashing never holds request threads.
     */
    @Bean(name = "credentialHashExecutor")
    public ThreadPoolTaskExecutor credentialHashExecutor(
            @Value("${app.credentials.hash-pool.core-size:4}") int coreSize,
            @Value("${app.credentials.hash-pool.max-size:8}") int maxSize,
            @Value("${app.credentials.hash-pool.queue-capacity:200}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("credential-hash-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(runnable -> {
            Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        });
        return executor;
    }
}
