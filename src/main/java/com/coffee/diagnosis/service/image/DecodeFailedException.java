package com.coffee.diagnosis.service.image;

/**
 * Raised when uploaded bytes are not a decodable image. This is a caller error and is the only
 * pipeline failure surfaced to clients.
 */
public class DecodeFailedException extends RuntimeException {

    public DecodeFailedException(String message) {
        super(message);
    }

    public DecodeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
