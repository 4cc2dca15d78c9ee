package com.jasmin.trafficshield.exceptions;

public class PersistenceException extends TrafficShieldException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
