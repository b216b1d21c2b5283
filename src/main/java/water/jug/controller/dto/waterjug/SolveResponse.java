package water.jug.controller.dto.waterjug;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import water.jug.domain.SolveResult;
import water.jug.service.SolveOutcome;

/**
 * Solve response.
 *
 * <p>Solvable: {@code solution} holds the steps and {@code totalSteps} their count. Unsolvable:
 * no {@code solution}, {@code message} is "No solution possible", {@code reason} tells why and
 * {@code totalSteps} is 0.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolveResponse(
    List<SolutionStepResponse> solution,
    String message,
    String reason,
    @JsonProperty("isSolvable") boolean solvable,
    int totalSteps,
    boolean fromCache) {

  public static final String NO_SOLUTION = "No solution possible";

  public static SolveResponse from(SolveOutcome outcome) {
    SolveResult result = outcome.result();
    if (!result.solvable()) {
      return new SolveResponse(
          null, NO_SOLUTION, result.reason().getDescription(), false, 0, outcome.fromCache());
    }
    List<SolutionStepResponse> steps =
        result.steps().stream().map(SolutionStepResponse::from).toList();
    return new SolveResponse(steps, null, null, true, steps.size(), outcome.fromCache());
  }
}
