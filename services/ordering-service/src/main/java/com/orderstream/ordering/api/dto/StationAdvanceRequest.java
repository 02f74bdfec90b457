package com.orderstream.ordering.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Items to advance; an empty or missing list advances the whole queue. */
public record StationAdvanceRequest(@JsonProperty("item_ids") List<String> itemIds) {
}
