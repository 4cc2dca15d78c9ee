package com.jasmin.trafficshield.exceptions;

/** Outlier model could not be fitted or could not score an observation. */
public class ModelException extends TrafficShieldException {

    public ModelException(String message) {
        super(message);
    }

    public ModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
