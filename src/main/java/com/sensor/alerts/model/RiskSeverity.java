package com.sensor.alerts.model;

import java.util.Locale;

public enum RiskSeverity {
    CRITICAL("🔴"),
    HIGH("🟠"),
    MEDIUM("🟡"),
    LOW("🟢");

    public static final String FALLBACK_GLYPH = "🔵";

    private final String glyph;

    RiskSeverity(String glyph) {
        this.glyph = glyph;
    }

    public String getGlyph() {
        return glyph;
    }

    public static String glyphFor(String riskLabel) {
        if (riskLabel == null) return FALLBACK_GLYPH;
        try {
            return valueOf(riskLabel.toUpperCase(Locale.ROOT)).glyph;
        } catch (IllegalArgumentException e) {
            return FALLBACK_GLYPH;
        }
    }
}
