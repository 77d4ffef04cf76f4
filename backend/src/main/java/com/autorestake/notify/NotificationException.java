package com.autorestake.notify;

/** Delivery to the notification endpoint failed. Always caught inside the notifier. */
public class NotificationException extends RuntimeException {
    public NotificationException(String message) { super(message); }
    public NotificationException(String message, Throwable cause) { super(message, cause); }
}
