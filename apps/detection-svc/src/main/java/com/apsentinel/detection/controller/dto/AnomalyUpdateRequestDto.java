package com.apsentinel.detection.controller.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnomalyUpdateRequestDto(
        @NotBlank @Size(max = 32) String status,
        @Size(max = 2000) String resolutionNotes
) {
}
