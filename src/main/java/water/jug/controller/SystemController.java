package water.jug.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import water.jug.config.ApiInfoProperties;
import water.jug.controller.dto.system.HealthResponse;
import water.jug.controller.dto.system.RootResponse;

/**
 * Root and lightweight health endpoints.
 *
 * <p>{@code /health} is a static liveness summary; component health (including a solver self
 * check) is at {@code /actuator/health}.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "System", description = "Service metadata")
public class SystemController {

  static final String HEALTHY = "Healthy";
  static final String DEFAULT_ENVIRONMENT = "default";
  static final String DOCUMENTATION_PATH = "/swagger-ui.html";

  private final ApiInfoProperties apiInfo;
  private final Environment environment;

  @GetMapping("/")
  @Operation(summary = "Service entry point")
  public ResponseEntity<RootResponse> root() {
    return ResponseEntity.ok(
        new RootResponse(apiInfo.name(), DOCUMENTATION_PATH, "/health", apiInfo.version()));
  }

  @GetMapping("/health")
  @Operation(summary = "Liveness summary")
  public ResponseEntity<HealthResponse> health() {
    String[] profiles = environment.getActiveProfiles();
    String activeEnvironment = profiles.length > 0 ? profiles[0] : DEFAULT_ENVIRONMENT;
    return ResponseEntity.ok(
        new HealthResponse(HEALTHY, Instant.now(), apiInfo.version(), activeEnvironment));
  }
}
