package com.provote.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(
    String error,
    @JsonProperty("error_code") String errorCode,
    @JsonProperty("status_code") int statusCode
) {}
