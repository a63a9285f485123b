package com.coffee.diagnosis.service.inference;

public final class Softmax {

    private Softmax() {
    }

    public static double[] apply(float[] scores) {
        double[] result = new double[scores.length];
        if (scores.length == 0) {
            return result;
        }
        double max = Double.NEGATIVE_INFINITY;
        for (float score : scores) {
            max = Math.max(max, score);
        }
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            result[i] = Math.exp(scores[i] - max);
            sum += result[i];
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= sum;
        }
        return result;
    }
}
