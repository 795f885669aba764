package vantage.assist.llm;

public class ProviderCallException extends RuntimeException {
    private final ProviderFailureKind kind;
    private final int status;

    public ProviderCallException(ProviderFailureKind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public ProviderCallException(ProviderFailureKind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public ProviderFailureKind kind() {
        return kind;
    }

    /** HTTP status, or -1 when no response was received. */
    public int status() {
        return status;
    }
}
