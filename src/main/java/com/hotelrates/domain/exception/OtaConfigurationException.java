package com.hotelrates.domain.exception;

/**
 * The OTA whitelist or the adapter registry could not be set up. Raised during startup only.
 */
public class OtaConfigurationException extends RuntimeException {

    public OtaConfigurationException(String message) {
        super(message);
    }

    public OtaConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
