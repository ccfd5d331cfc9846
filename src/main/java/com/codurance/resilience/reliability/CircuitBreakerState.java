package com.codurance.resilience.reliability;

import java.util.Locale;

public enum CircuitBreakerState {
    /** Calls pass through. */
    CLOSED,
    /** Calls are rejected without reaching the downstream dependency. */
    OPEN,
    /** Cooldown elapsed; the next calls are let through as trials. */
    HALF_OPEN;

    /** Lower-case form used in metric labels and log fields. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
