package com.ammann.biometrics.exception;

/**
 * Failure to load a biomarker series from the backing store.
 *
 * <p>Thrown by {@link com.ammann.biometrics.source.TimeSeriesSource} implementations. The
 * daily analysis catches it per sub-analysis; at the API boundary it maps to HTTP 503.
 */
public class TimeSeriesSourceException extends ApiException {

    private final String userId;
    private final String biomarker;

    public TimeSeriesSourceException(String userId, String biomarker, Throwable cause) {
        super(String.format("Failed to load %s for user %s: %s",
                biomarker, userId, cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.userId = userId;
        this.biomarker = biomarker;
    }

    public String getUserId() {
        return userId;
    }

    public String getBiomarker() {
        return biomarker;
    }
}
