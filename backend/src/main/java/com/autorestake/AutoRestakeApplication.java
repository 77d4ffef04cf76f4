package com.autorestake;

import com.autorestake.config.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the restake keeper.
 * Any startup failure (most often a {@link ConfigurationException}) terminates the process with exit code 1;
 * SIGTERM/SIGINT shut it down gracefully with exit code 0.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class AutoRestakeApplication {

    public static void main(String[] args) {
        ShutdownSignals.install();
        try {
            SpringApplication.run(AutoRestakeApplication.class, args);
        } catch (Exception e) {
            log.error("[keeper] fatal startup error: {}", ConfigurationException.rootMessage(e));
            System.exit(1);
        }
    }
}
