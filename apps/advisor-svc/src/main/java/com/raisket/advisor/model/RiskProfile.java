package com.raisket.advisor.model;

import java.util.Locale;

public enum RiskProfile {
    CONSERVATIVE(Instrument.RiskLevel.LOW),
    MODERATE(Instrument.RiskLevel.MEDIUM),
    AGGRESSIVE(Instrument.RiskLevel.HIGH);

    private final Instrument.RiskLevel overallRisk;

    RiskProfile(Instrument.RiskLevel overallRisk) {
        this.overallRisk = overallRisk;
    }

    public Instrument.RiskLevel overallRisk() {
        return overallRisk;
    }

    public static RiskProfile parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("risk profile must be provided");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "conservative", "conservador" -> CONSERVATIVE;
            case "moderate", "moderado" -> MODERATE;
            case "aggressive", "agresivo" -> AGGRESSIVE;
            default -> throw new IllegalArgumentException("Unknown risk profile: " + value);
        };
    }
}
