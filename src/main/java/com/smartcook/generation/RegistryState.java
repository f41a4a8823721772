package com.smartcook.generation;

public record RegistryState(String previous, String current) {
    public static RegistryState initial() {
        return new RegistryState(null, null);
    }

    public boolean hasCurrent() {
        return current != null && !current.isBlank();
    }
}
