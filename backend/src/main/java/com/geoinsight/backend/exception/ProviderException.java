package com.geoinsight.backend.exception;

/**
 * Failure of an external collaborator (map data, imagery, embedding model,
 * language model, geocoder).
 */
public class ProviderException extends AnalysisException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(ErrorType.PROVIDER_ERROR, provider + ": " + message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(ErrorType.PROVIDER_ERROR, provider + ": " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
