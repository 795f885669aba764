package vantage.assist.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    /** Cooldown elapsed; the next call (only one) tests the provider. */
    HALF_OPEN
}
