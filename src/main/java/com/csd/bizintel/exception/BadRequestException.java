package com.csd.bizintel.exception;

/**
 * Thrown by the HTTP layer when a request is well-formed JSON but cannot be served as asked.
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
