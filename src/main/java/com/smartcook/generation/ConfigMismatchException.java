package com.smartcook.generation;

public class ConfigMismatchException extends IllegalStateException {
    public ConfigMismatchException(String message) {
        super(message);
    }
}
