package com.coffee.diagnosis.service.inference;

public class InferenceFailedException extends RuntimeException {

    public InferenceFailedException(String message) {
        super(message);
    }

    public InferenceFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
