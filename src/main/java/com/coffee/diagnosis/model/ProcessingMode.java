package com.coffee.diagnosis.model;

public enum ProcessingMode {
    SYNC,
    ASYNC
}
