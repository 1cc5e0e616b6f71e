package com.studentdesk.application.ports;

/**
 * Abstraction over configuration and secrets.
 * Infrastructure provides implementation (file/env).
 */
public interface ConfigPort {

    String get(String key);

    String get(String key, String defaultValue);

    int getInt(String key, int defaultValue);

    boolean getBoolean(String key, boolean defaultValue);

    /** Returns a secret value. Never log it. */
    String getSecret(String key);
}
