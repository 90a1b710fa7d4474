package uk.gegc.adaptivequiz.features.session.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

public record HeartbeatResponse(
        @Schema(example = "active")
        @JsonProperty("status") String status
) {
    public static HeartbeatResponse active() {
        return new HeartbeatResponse("active");
    }
}
