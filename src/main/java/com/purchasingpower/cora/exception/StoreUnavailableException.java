package com.purchasingpower.cora.exception;

import lombok.Getter;

@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Index store unavailable during " + operation, cause);
        this.operation = operation;
    }
}
