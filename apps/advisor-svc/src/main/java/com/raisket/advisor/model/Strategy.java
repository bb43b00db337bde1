package com.raisket.advisor.model;

import java.util.Locale;

public enum Strategy {
    /** Highest annual rate first. */
    AVALANCHE,
    /** Lowest principal first. */
    SNOWBALL;

    /**
     * Resolves a strategy label. Spanish labels used by the product ("avalancha", "bola de nieve") are
     * accepted alongside the English ones.
     */
    public static Strategy parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("strategy must be provided");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return switch (normalized) {
            case "avalanche", "avalancha" -> AVALANCHE;
            case "snowball", "bola_de_nieve" -> SNOWBALL;
            default -> throw new IllegalArgumentException("Unknown debt strategy: " + value);
        };
    }
}
