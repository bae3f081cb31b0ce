package com.querycache.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FetchRequest {
    @NotBlank(message = "Query is required")
    private String query;

    private Map<String, Object> variables = new HashMap<>();

    private boolean useCache = true;
}
