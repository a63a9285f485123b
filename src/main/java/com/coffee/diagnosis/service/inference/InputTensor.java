package com.coffee.diagnosis.service.inference;

public record InputTensor(float[] data, long[] shape) {
}
