package com.stockgame.domain.enums;

/**
 * Magnitude band of a market event, derived from the absolute impact.
 * Never set by hand; see {@code PriceImpactCalculator#classifySeverity}.
 */
public enum EventSeverity {
    LOW,
    MEDIUM,
    HIGH,
    EXTREME
}
