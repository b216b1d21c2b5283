package water.jug.controller.dto.system;

import java.time.Instant;

public record HealthResponse(String status, Instant timestamp, String version, String environment) {}
