package com.autorestake.config;

/** Invalid or missing startup configuration. Fatal: the process exits with code 1. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }

    /** The configuration error if there is one in the chain, otherwise the root cause. */
    public static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (!(cur instanceof ConfigurationException) && cur.getCause() != null && cur.getCause() != cur) {
            cur = cur.getCause();
        }
        return cur.getMessage();
    }
}
