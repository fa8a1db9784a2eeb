package com.catalog.inventory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteResult(
        @JsonProperty("deleted") Long deletedId) {
}
