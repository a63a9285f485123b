package com.coffee.diagnosis.service.ensemble;

public class EmptyEnsembleException extends RuntimeException {

    public EmptyEnsembleException(String message) {
        super(message);
    }
}
