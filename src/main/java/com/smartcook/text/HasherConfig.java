package com.smartcook.text;

public record HasherConfig(String scheme, int dimension) {
    public static final String STRING_HASH_V1 = "string-hash-l2-v1";

    public HasherConfig {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Hashed dimensionality must be positive: " + dimension);
        }
    }

    public static HasherConfig of(int dimension) {
        return new HasherConfig(STRING_HASH_V1, dimension);
    }
}
