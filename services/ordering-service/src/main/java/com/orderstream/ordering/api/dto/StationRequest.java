package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderstream.syncmodel.OrderStatus;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record StationRequest(
        @JsonProperty("name") @NotBlank String name,
        @JsonProperty("category_ids") List<String> categoryIds,
        @JsonProperty("input_statuses") List<OrderStatus> inputStatuses,
        @JsonProperty("output_status") @NotNull OrderStatus outputStatus
) {
}
