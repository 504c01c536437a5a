package com.adlanda.codecontext.embedding;

/**
 * Raised when the embedding provider cannot produce a vector: invalid credential,
 * exhausted quota, network failure or timeout.
 */
public class ProviderException extends RuntimeException {

    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
