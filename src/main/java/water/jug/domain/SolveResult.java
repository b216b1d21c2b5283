package water.jug.domain;

import java.util.List;

/**
 * Outcome of one solve.
 *
 * <p>Either {@code solvable} with a non-empty, ordered step list and no reason, or unsolvable with
 * a reason and no steps. Immutable; safe to share through the solution cache.
 */
public record SolveResult(boolean solvable, List<SolutionStep> steps, UnsolvableReason reason) {

  public SolveResult {
    steps = steps != null ? List.copyOf(steps) : List.of();
  }

  public static SolveResult solved(List<SolutionStep> steps) {
    if (steps == null || steps.isEmpty()) {
      throw new IllegalArgumentException("A solved result needs at least one step");
    }
    return new SolveResult(true, steps, null);
  }

  public static SolveResult unsolvable(UnsolvableReason reason) {
    return new SolveResult(false, List.of(), reason);
  }

  public int totalSteps() {
    return steps.size();
  }

  public SolutionStep finalStep() {
    if (steps.isEmpty()) {
      throw new IllegalStateException("Unsolvable result has no steps: " + reason);
    }
    return steps.get(steps.size() - 1);
  }
}
