package water.jug.global.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import water.jug.domain.SolveResult;
import water.jug.service.solver.WaterJugSolver;

/**
 * Solver self check, exposed as the {@code solver} component of {@code /actuator/health}.
 *
 * <p>Solves the reference puzzle X=2, Y=10, Z=4 on the raw solver (bypassing the cache) and
 * expects the known 4-step answer.
 */
@Component
@RequiredArgsConstructor
public class SolverHealthIndicator implements HealthIndicator {

  static final int REFERENCE_X = 2;
  static final int REFERENCE_Y = 10;
  static final int REFERENCE_Z = 4;
  static final int REFERENCE_STEPS = 4;

  private final WaterJugSolver solver;

  @Override
  public Health health() {
    SolveResult result = solver.solve(REFERENCE_X, REFERENCE_Y, REFERENCE_Z);
    String reference = REFERENCE_X + "," + REFERENCE_Y + "," + REFERENCE_Z;

    if (result.solvable() && result.totalSteps() == REFERENCE_STEPS) {
      return Health.up()
          .withDetail("reference", reference)
          .withDetail("steps", result.totalSteps())
          .build();
    }
    return Health.down()
        .withDetail("reference", reference)
        .withDetail("expectedSteps", REFERENCE_STEPS)
        .withDetail("actualSteps", result.totalSteps())
        .build();
  }
}
