package com.jasmin.trafficshield.exceptions;

/** Source identifier rejected before any state is touched. */
public class SourceValidationException extends TrafficShieldException {

    public SourceValidationException(String message) {
        super(message);
    }
}
