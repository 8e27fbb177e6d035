package com.astrofiler.model;

import java.util.Locale;
import java.util.Optional;

public enum ImageType {
    LIGHT("Light"),
    FLAT("Flat"),
    DARK("Dark"),
    BIAS("Bias");

    private final String label;

    ImageType(String label) {
        this.label = label;
    }

    /** Label stored in the database and used as the OBJECT of calibration frames. */
    public String label() {
        return label;
    }

    public boolean isCalibration() {
        return this != LIGHT;
    }

    /**
     * Detects the frame type from an IMAGETYP value by substring, in declaration order
     * (LIGHT, FLAT, DARK, BIAS), so "Light Frame" and "DARKMASTER" both resolve.
     */
    public static Optional<ImageType> fromImageTyp(String imageTyp) {
        if (imageTyp == null) return Optional.empty();
        String upper = imageTyp.toUpperCase(Locale.ROOT);
        for (ImageType t : values()) {
            if (upper.contains(t.name())) return Optional.of(t);
        }
        return Optional.empty();
    }

    public static Optional<ImageType> fromLabel(String label) {
        if (label == null) return Optional.empty();
        for (ImageType t : values()) {
            if (t.label.equalsIgnoreCase(label.trim())) return Optional.of(t);
        }
        return Optional.empty();
    }
}
