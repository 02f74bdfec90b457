package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record CategoryRequest(@JsonProperty("name") @NotBlank String name) {
}
