package com.vaultoracle.orchestrator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Closes the application context, then exits the JVM with the given code.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringProcessTerminator implements ProcessTerminator {

    private final ApplicationContext applicationContext;

    @Override
    public void terminate(int exitCode) {
        log.error("Terminating process with exit code {}", exitCode);
        try {
            SpringApplication.exit(applicationContext, () -> exitCode);
        } finally {
            System.exit(exitCode);
        }
    }
}
