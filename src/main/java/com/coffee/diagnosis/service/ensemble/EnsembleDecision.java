package com.coffee.diagnosis.service.ensemble;

public record EnsembleDecision(
        String diseaseName,
        double confidence,
        int members,
        int totalVotes,
        double meanConfidence,
        double stabilityBonus) {
}
