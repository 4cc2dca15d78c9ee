package com.jasmin.trafficshield.exceptions;

public class TrafficShieldException extends RuntimeException {

    public TrafficShieldException(String message) {
        super(message);
    }

    public TrafficShieldException(String message, Throwable cause) {
        super(message, cause);
    }
}
