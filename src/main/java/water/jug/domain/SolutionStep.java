package water.jug.domain;

/**
 * One move of a solution, with the volumes after the move.
 *
 * @param step 1-based position in the solution
 * @param x volume in bucket X after the move
 * @param y volume in bucket Y after the move
 * @param action human readable move label
 * @param terminal true only for the last step, the one that reaches the target
 */
public record SolutionStep(int step, int x, int y, String action, boolean terminal) {

  static final String ALREADY_EMPTY = "Both buckets are already empty";

  /** The single step returned for a zero target: nothing to do. */
  public static SolutionStep alreadySatisfied() {
    return new SolutionStep(1, 0, 0, ALREADY_EMPTY, true);
  }

  public JugState state() {
    return new JugState(x, y);
  }
}
