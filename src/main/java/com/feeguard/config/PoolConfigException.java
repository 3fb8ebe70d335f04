package com.feeguard.config;

/**
 * Thrown when a pool configuration is rejected. The previously active configuration
 * is left untouched.
 */
public class PoolConfigException extends RuntimeException {

    private final ConfigErrorCode errorCode;

    public PoolConfigException(ConfigErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ConfigErrorCode getErrorCode() {
        return errorCode;
    }
}
