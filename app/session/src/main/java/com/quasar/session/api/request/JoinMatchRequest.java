package com.quasar.session.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

/** Body of both the public join and the invite-code join. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JoinMatchRequest(@Size(max = 3) String monogram, @Size(max = 32) String name) {}
