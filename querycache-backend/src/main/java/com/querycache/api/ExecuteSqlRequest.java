package com.querycache.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExecuteSqlRequest {
    @NotBlank(message = "File path is required")
    private String filePath;

    private Map<String, Object> variables = new HashMap<>();
}
