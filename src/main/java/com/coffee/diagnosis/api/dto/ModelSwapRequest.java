package com.coffee.diagnosis.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ModelSwapRequest(@NotBlank String fileName, @NotBlank String version) {
}
