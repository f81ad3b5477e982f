package com.phodal.tracebrain.error;

/**
 * Failure of the downstream language-model provider.
 */
public class ProviderException extends TraceBrainException {

    private final boolean retryable;

    public ProviderException(String message) {
        this(message, true, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, true, cause);
    }

    public ProviderException(String message, boolean retryable, Throwable cause) {
        super(ErrorCode.PROVIDER_ERROR, message, cause);
        this.retryable = retryable;
    }

    /**
     * Configuration problems (missing provider, bad credentials) are not worth retrying.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
