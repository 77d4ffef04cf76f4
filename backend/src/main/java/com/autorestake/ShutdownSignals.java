package com.autorestake;

import lombok.extern.slf4j.Slf4j;
import sun.misc.Signal;

import java.util.List;

/**
 * TERM and INT end the process with status 0.
 * {@link System#exit} still runs the Spring shutdown hook, so the schedule is cancelled
 * and an in-flight run is drained before the JVM goes away.
 */
@Slf4j
final class ShutdownSignals {

    private ShutdownSignals() {}

    static void install() {
        for (String name : List.of("TERM", "INT")) {
            try {
                Signal.handle(new Signal(name), signal -> {
                    log.info("[keeper] SIG{} received, shutting down gracefully...", signal.getName());
                    System.exit(0);
                });
            } catch (IllegalArgumentException e) {
                log.warn("[keeper] SIG{} not handled, the JVM default applies: {}", name, e.getMessage());
            }
        }
    }
}
