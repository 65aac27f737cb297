package com.queryguard.service.core.shape;

import java.util.Locale;

/** Shape keys are compared case-insensitively; hashes are stored in uppercase. */
public final class ShapeKeys {

    private ShapeKeys() {}

    public static String normalize(String shapeKey) {
        if (shapeKey == null || shapeKey.isBlank()) {
            throw new IllegalArgumentException("shapeKey is required");
        }
        return shapeKey.trim().toUpperCase(Locale.ROOT);
    }
}
