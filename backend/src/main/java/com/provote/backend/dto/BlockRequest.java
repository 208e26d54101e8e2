package com.provote.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record BlockRequest(@NotBlank String reason) {}
