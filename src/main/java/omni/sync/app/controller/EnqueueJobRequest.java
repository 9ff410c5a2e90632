package omni.sync.app.controller;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;

public record EnqueueJobRequest(@NotBlank String kind, JsonNode payload, String batchId) {
}
