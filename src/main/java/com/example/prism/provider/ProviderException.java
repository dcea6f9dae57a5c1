package com.example.prism.provider;

/**
 * Raised by a price provider when it cannot answer a request, including
 * deadline expiry and thread interruption.
 */
public class ProviderException extends Exception {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(provider + ": " + message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
