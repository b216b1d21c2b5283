package water.jug.service;

import water.jug.domain.SolveResult;

/**
 * A solve result together with where it came from.
 *
 * @param result solver output, identical whether fresh or cached
 * @param fromCache true when served from the solution cache
 */
public record SolveOutcome(SolveResult result, boolean fromCache) {

  public static SolveOutcome fresh(SolveResult result) {
    return new SolveOutcome(result, false);
  }

  public static SolveOutcome cached(SolveResult result) {
    return new SolveOutcome(result, true);
  }
}
