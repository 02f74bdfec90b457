package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.orderstream.syncmodel.OrderStatus;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BulkStatusRequest(
        @JsonProperty("ids") @NotEmpty List<String> ids,
        @JsonProperty("status") @NotNull OrderStatus status
) {
}
