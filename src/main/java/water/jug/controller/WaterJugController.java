package water.jug.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import water.jug.config.ApiInfoProperties;
import water.jug.controller.dto.waterjug.ApiInfoResponse;
import water.jug.controller.dto.waterjug.SolveRequest;
import water.jug.controller.dto.waterjug.SolveResponse;
import water.jug.service.WaterJugService;

/**
 * Water jug API.
 *
 * <ul>
 *   <li>POST /api/waterjug/solve: shortest solution or "No solution possible"
 *   <li>GET /api/waterjug/info: API metadata
 * </ul>
 *
 * <p>Invalid input never reaches the service; see {@link SolveRequest} for the rules.
 */
@Slf4j
@RestController
@RequestMapping("/api/waterjug")
@RequiredArgsConstructor
@Tag(name = "Water Jug", description = "Water jug riddle solver")
public class WaterJugController {

  static final ApiInfoResponse.Endpoints ENDPOINTS =
      new ApiInfoResponse.Endpoints(
          "POST /api/waterjug/solve", "GET /api/waterjug/info", "GET /health");
  static final SolveRequest SAMPLE_REQUEST = new SolveRequest(2, 10, 4);

  private final WaterJugService waterJugService;
  private final ApiInfoProperties apiInfo;

  @PostMapping("/solve")
  @Operation(
      summary = "Solve the water jug riddle",
      description =
          "Returns the minimum number of fill, empty and transfer moves that leave the wanted"
              + " amount in either bucket, or isSolvable=false when no sequence exists.")
  public ResponseEntity<SolveResponse> solve(@Valid @RequestBody SolveRequest request) {
    return ResponseEntity.ok(SolveResponse.from(waterJugService.solve(request.toPuzzle())));
  }

  @GetMapping("/info")
  @Operation(summary = "API information")
  public ResponseEntity<ApiInfoResponse> info() {
    log.info("[WaterJug] API info requested");
    return ResponseEntity.ok(
        new ApiInfoResponse(
            apiInfo.name(), apiInfo.version(), apiInfo.description(), ENDPOINTS, SAMPLE_REQUEST));
  }
}
