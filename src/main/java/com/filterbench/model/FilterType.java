package com.filterbench.model;

import java.util.Locale;

/**
 * The closed set of filters a batch can apply.
 */
public enum FilterType {
    BLUR("Blur"),
    GRAYSCALE("Grayscale"),
    CONTOUR("Contour"),
    EMBOSS("Emboss"),
    SHARPEN("Sharpen"),
    DETAIL("Detail"),
    EDGE_DETECT("Edge Detect");

    private final String label;

    FilterType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Resolves a filter from its constant name or its display label, ignoring
     * case, spaces and dashes ("edge-detect", "Edge Detect", "EDGE_DETECT").
     *
     * @throws IllegalArgumentException if the name matches no filter
     */
    public static FilterType fromString(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Filter name is required");
        }
        String normalized = name.trim()
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
        for (FilterType type : values()) {
            if (type.name().equals(normalized) || type.label.equalsIgnoreCase(name.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter: " + name);
    }
}
