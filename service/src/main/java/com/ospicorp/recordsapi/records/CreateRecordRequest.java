package com.ospicorp.recordsapi.records;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateRecordRequest(
    @NotBlank @Schema(description = "Calendar date", example = "2024-03-01") String date,
    @NotNull @Schema(description = "Arbitrary JSON object", example = "{\"temp\":21.5}") JsonNode data
) {}
