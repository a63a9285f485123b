package com.coffee.diagnosis.model;

public record ClassProbability(String diseaseName, double confidence) {
}
