package vantage.assist.llm;

public enum ProviderFailureKind {
    TRANSPORT(true),
    TIMEOUT(true),
    SERVER_ERROR(true),
    /** 4xx status; a request problem, not a provider-health signal. */
    CLIENT_ERROR(false),
    MALFORMED_RESPONSE(false),
    CANCELLED(false);

    private final boolean transientFailure;

    ProviderFailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /** Retried with backoff and counted by the circuit breaker. */
    public boolean isTransient() {
        return transientFailure;
    }
}
