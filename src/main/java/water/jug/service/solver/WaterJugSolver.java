package water.jug.service.solver;

import water.jug.domain.SolveResult;

public interface WaterJugSolver {
  /**
   * Finds a shortest sequence of moves that leaves {@code target} units in either bucket.
   *
   * <p>Pure and deterministic: the same arguments always give an equal result, and no state is
   * kept between calls.
   *
   * @throws water.jug.global.error.exception.InvalidJugConfigurationException if a capacity is
   *     not positive or the target is negative
   */
  SolveResult solve(int capacityX, int capacityY, int target);
}
