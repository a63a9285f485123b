package com.coffee.diagnosis.model;

public enum RequestStatus {
    PENDING,
    PROCESSING,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
