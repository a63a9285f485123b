package com.coffee.diagnosis.service.preprocessing;

/**
 * Perturbations applied to the base image for ensemble inference, in generation order.
 */
public enum Augmentation {
    IDENTITY,
    ROTATE_CLOCKWISE,
    ROTATE_COUNTER_CLOCKWISE,
    BRIGHTEN,
    DARKEN,
    CONTRAST_UP,
    CONTRAST_DOWN,
    SATURATE
}
