package com.quasar.session.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PrivateMatchRequest(
    @NotBlank String gameType, @Size(max = 3) String monogram, @Size(max = 32) String name) {}
