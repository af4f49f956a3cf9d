package com.streamearn.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record SubmitActivityRequest(
        @NotBlank
        @Size(max = 128)
        String contentId,

        @NotNull
        @Positive
        @Max(86_400)
        Long durationSeconds
) {
}
