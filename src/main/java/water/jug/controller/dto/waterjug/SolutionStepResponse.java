package water.jug.controller.dto.waterjug;

import com.fasterxml.jackson.annotation.JsonInclude;
import water.jug.domain.SolutionStep;

/**
 * @param status "Solved" on the last step, absent otherwise
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolutionStepResponse(
    int step, int bucketX, int bucketY, String action, String status) {

  static final String SOLVED = "Solved";

  public static SolutionStepResponse from(SolutionStep step) {
    return new SolutionStepResponse(
        step.step(), step.x(), step.y(), step.action(), step.terminal() ? SOLVED : null);
  }
}
