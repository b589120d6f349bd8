package com.poolintelligence.common.exception;

public class PoolIntelligenceException extends RuntimeException {
    private final String component;

    public PoolIntelligenceException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public PoolIntelligenceException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
