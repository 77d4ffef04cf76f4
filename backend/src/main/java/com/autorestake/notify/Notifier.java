package com.autorestake.notify;

/**
 * Best-effort status channel. Implementations must never throw to the caller.
 */
public interface Notifier {

    void notify(String message, boolean isError);

    default void notify(String message) {
        notify(message, false);
    }
}
