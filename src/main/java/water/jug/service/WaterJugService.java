package water.jug.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import water.jug.config.CacheConfig;
import water.jug.domain.JugPuzzle;
import water.jug.domain.SolveResult;
import water.jug.global.error.exception.base.ClientBaseException;
import water.jug.service.solver.WaterJugSolver;

/**
 * Cache boundary around {@link WaterJugSolver}.
 *
 * <p>The solver stays pure; this service owns lookup and population of the {@code jugSolutions}
 * cache. Results are deterministic per puzzle, so serving a cached one is transparent apart from
 * the {@link SolveOutcome#fromCache()} flag.
 *
 * <h3>Metrics</h3>
 *
 * <ul>
 *   <li>{@code waterjug.cache{result=hit|miss}}: cache lookups
 *   <li>{@code waterjug.solve{solvable=true|false}}: time spent in fresh solves
 * </ul>
 */
@Slf4j
@Service
public class WaterJugService {

  private final WaterJugSolver solver;
  private final Cache solutionCache;
  private final MeterRegistry meterRegistry;

  public WaterJugService(
      WaterJugSolver solver, CacheManager cacheManager, MeterRegistry meterRegistry) {
    this.solver = solver;
    this.meterRegistry = meterRegistry;
    this.solutionCache = cacheManager.getCache(CacheConfig.JUG_SOLUTIONS);
    if (this.solutionCache == null) {
      throw new IllegalStateException("Cache not configured: " + CacheConfig.JUG_SOLUTIONS);
    }
  }

  public SolveOutcome solve(JugPuzzle puzzle) {
    SolveResult cached = solutionCache.get(puzzle, SolveResult.class);
    if (cached != null) {
      meterRegistry.counter("waterjug.cache", "result", "hit").increment();
      log.info(
          "[WaterJug] Serving cached result for {}. Solvable: {}", puzzle, cached.solvable());
      return SolveOutcome.cached(cached);
    }
    meterRegistry.counter("waterjug.cache", "result", "miss").increment();

    log.info("[WaterJug] Attempting to solve: {}", puzzle);
    Timer.Sample sample = Timer.start(meterRegistry);
    SolveResult result;
    try {
      result = solver.solve(puzzle.capacityX(), puzzle.capacityY(), puzzle.target());
    } catch (ClientBaseException e) {
      throw e;
    } catch (RuntimeException e) {
      // stack trace is logged once by GlobalExceptionHandler
      log.error("[WaterJug] Error solving {}: {}", puzzle, e.toString());
      throw e;
    }
    sample.stop(
        meterRegistry.timer("waterjug.solve", "solvable", String.valueOf(result.solvable())));

    if (result.solvable()) {
      log.info("[WaterJug] Solved {}. Steps: {}", puzzle, result.totalSteps());
    } else {
      log.info(
          "[WaterJug] No solution for {}. Reason: {}", puzzle, result.reason().getDescription());
    }

    solutionCache.put(puzzle, result);
    return SolveOutcome.fresh(result);
  }
}
