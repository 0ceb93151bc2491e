package com.spanmatcher.config;

/**
 * 致命配置错误，在处理任何文档之前抛出。
 */
public class ConfigurationException extends RuntimeException {
    private final String key;
    private final String value;

    public ConfigurationException(String message, String key, String value) {
        super(buildMessage(message, key, value));
        this.key = key;
        this.value = value;
    }

    public ConfigurationException(String message, String key, String value, Throwable cause) {
        super(buildMessage(message, key, value), cause);
        this.key = key;
        this.value = value;
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    private static String buildMessage(String message, String key, String value) {
        if (key == null) {
            return message;
        }
        return message + " (" + key + "=" + value + ")";
    }
}
