package water.jug.controller;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import water.jug.config.ApiInfoProperties;
import water.jug.domain.JugPuzzle;
import water.jug.domain.SolutionStep;
import water.jug.domain.SolveResult;
import water.jug.domain.UnsolvableReason;
import water.jug.global.error.GlobalExceptionHandler;
import water.jug.service.SolveOutcome;
import water.jug.service.WaterJugService;

/**
 * WaterJugController unit tests.
 *
 * <p>Standalone MockMvc with the real {@link GlobalExceptionHandler}; no Spring context.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("WaterJugController unit tests")
class WaterJugControllerUnitTest {

  @Mock private WaterJugService waterJugService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    ApiInfoProperties apiInfo =
        new ApiInfoProperties("Water Jug Challenge API", "1.0.0", "Solves the water jug riddle");
    WaterJugController controller = new WaterJugController(waterJugService, apiInfo);

    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Nested
  @DisplayName("POST /api/waterjug/solve")
  class Solve {

    @Test
    @DisplayName("Solvable result maps to steps with a Solved status on the last one")
    void solvable_mapsSteps() throws Exception {
      // Given
      SolveResult result =
          SolveResult.solved(
              List.of(
                  new SolutionStep(1, 2, 0, "Fill bucket X", false),
                  new SolutionStep(2, 0, 2, "Transfer from bucket X to Y", true)));
      given(waterJugService.solve(new JugPuzzle(2, 10, 2))).willReturn(SolveOutcome.fresh(result));

      // When & Then
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"xCapacity\":2,\"yCapacity\":10,\"zAmountWanted\":2}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.isSolvable").value(true))
          .andExpect(jsonPath("$.totalSteps").value(2))
          .andExpect(jsonPath("$.fromCache").value(false))
          .andExpect(jsonPath("$.solution", hasSize(2)))
          .andExpect(jsonPath("$.solution[0].step").value(1))
          .andExpect(jsonPath("$.solution[0].bucketX").value(2))
          .andExpect(jsonPath("$.solution[0].bucketY").value(0))
          .andExpect(jsonPath("$.solution[0].action").value("Fill bucket X"))
          .andExpect(jsonPath("$.solution[0].status").doesNotExist())
          .andExpect(jsonPath("$.solution[1].status").value("Solved"))
          .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    @DisplayName("Unsolvable result has no solution, a message and zero steps")
    void unsolvable_mapsMessage() throws Exception {
      // Given
      given(waterJugService.solve(new JugPuzzle(2, 6, 5)))
          .willReturn(
              SolveOutcome.cached(SolveResult.unsolvable(UnsolvableReason.TARGET_NOT_REACHABLE)));

      // When & Then
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"xCapacity\":2,\"yCapacity\":6,\"zAmountWanted\":5}"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.isSolvable").value(false))
          .andExpect(jsonPath("$.message").value("No solution possible"))
          .andExpect(jsonPath("$.reason").value("target not reachable"))
          .andExpect(jsonPath("$.totalSteps").value(0))
          .andExpect(jsonPath("$.fromCache").value(true))
          .andExpect(jsonPath("$.solution").doesNotExist());
    }

    @Test
    @DisplayName("All violated rules are returned and the service is not called")
    void invalidInput_returnsAllViolations() throws Exception {
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"xCapacity\":0,\"yCapacity\":-2,\"zAmountWanted\":-1}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C001"))
          .andExpect(jsonPath("$.error").value("Validation failed"))
          .andExpect(jsonPath("$.message").value("Invalid input parameters"))
          .andExpect(
              jsonPath("$.validationErrors")
                  .value(
                      containsInAnyOrder(
                          "X capacity must be a positive integer",
                          "Y capacity must be a positive integer",
                          "Target amount must be a non-negative integer")));

      verify(waterJugService, never()).solve(any());
    }

    @Test
    @DisplayName("Missing fields bind to zero and fail validation")
    void missingFields_failValidation() throws Exception {
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"zAmountWanted\":3}"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.validationErrors", hasSize(2)));
    }

    @Test
    @DisplayName("Unparseable JSON is a 400 with code C002")
    void malformedJson_returnsBadRequest() throws Exception {
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{ invalid json }"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value("C002"));

      verify(waterJugService, never()).solve(any());
    }

    @Test
    @DisplayName("Unexpected service failure is a generic 500")
    void serviceFailure_returnsInternalError() throws Exception {
      // Given
      given(waterJugService.solve(any())).willThrow(new IllegalStateException("arena corrupted"));

      // When & Then
      mockMvc
          .perform(
              post("/api/waterjug/solve")
                  .contentType(MediaType.APPLICATION_JSON)
                  .content("{\"xCapacity\":3,\"yCapacity\":5,\"zAmountWanted\":4}"))
          .andExpect(status().isInternalServerError())
          .andExpect(jsonPath("$.code").value("S001"))
          .andExpect(jsonPath("$.error").value("Internal server error"))
          .andExpect(jsonPath("$.message").value("An error occurred while processing your request"));
    }
  }

  @Test
  @DisplayName("GET /api/waterjug/info returns metadata and a sample request")
  void info_returnsMetadata() throws Exception {
    mockMvc
        .perform(get("/api/waterjug/info"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Water Jug Challenge API"))
        .andExpect(jsonPath("$.version").value("1.0.0"))
        .andExpect(jsonPath("$.endpoints.solve").value("POST /api/waterjug/solve"))
        .andExpect(jsonPath("$.endpoints.info").value("GET /api/waterjug/info"))
        .andExpect(jsonPath("$.endpoints.health").value("GET /health"))
        .andExpect(jsonPath("$.sampleRequest.xCapacity").value(2))
        .andExpect(jsonPath("$.sampleRequest.yCapacity").value(10))
        .andExpect(jsonPath("$.sampleRequest.zAmountWanted").value(4));
  }
}
