package water.jug.service.solver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import water.jug.domain.JugAction;
import water.jug.domain.JugState;
import water.jug.domain.SolutionStep;
import water.jug.domain.SolveResult;
import water.jug.domain.UnsolvableReason;
import water.jug.global.error.exception.InvalidJugConfigurationException;

/**
 * Breadth-first search over bucket states.
 *
 * <h3>Flow</h3>
 *
 * <ol>
 *   <li>Feasibility check: a target above both capacities, or not a multiple of {@code gcd(X, Y)},
 *       is rejected without searching.
 *   <li>Zero target: answered with a single "already empty" step.
 *   <li>BFS from {@code (0, 0)}. The goal test runs on dequeue, so the first goal found is at
 *       minimum depth.
 *   <li>The parent chain of the goal is walked back to the root and reversed into steps.
 * </ol>
 *
 * <p>Discovered states live in an arena list; each entry keeps the arena index of its parent.
 * Time and space are {@code O(X * Y)}.
 */
@Slf4j
@Component
public class BfsWaterJugSolver implements WaterJugSolver {

  private static final int NO_PARENT = -1;

  @Override
  public SolveResult solve(int capacityX, int capacityY, int target) {
    if (capacityX <= 0 || capacityY <= 0 || target < 0) {
      throw new InvalidJugConfigurationException(capacityX, capacityY, target);
    }

    Optional<UnsolvableReason> infeasible = checkFeasibility(capacityX, capacityY, target);
    if (infeasible.isPresent()) {
      return SolveResult.unsolvable(infeasible.get());
    }

    if (target == 0) {
      return SolveResult.solved(List.of(SolutionStep.alreadySatisfied()));
    }

    return search(capacityX, capacityY, target);
  }

  private Optional<UnsolvableReason> checkFeasibility(int capacityX, int capacityY, int target) {
    if (target == 0) {
      return Optional.empty();
    }
    if (target > Math.max(capacityX, capacityY)) {
      return Optional.of(UnsolvableReason.TARGET_EXCEEDS_CAPACITIES);
    }
    if (target % gcd(capacityX, capacityY) != 0) {
      return Optional.of(UnsolvableReason.TARGET_NOT_REACHABLE);
    }
    return Optional.empty();
  }

  static int gcd(int a, int b) {
    while (b != 0) {
      int remainder = a % b;
      a = b;
      b = remainder;
    }
    return a;
  }

  private SolveResult search(int capacityX, int capacityY, int target) {
    List<Node> arena = new ArrayList<>();
    Set<JugState> visited = new HashSet<>();
    Deque<Integer> frontier = new ArrayDeque<>();

    arena.add(new Node(JugState.EMPTY, NO_PARENT, null));
    visited.add(JugState.EMPTY);
    frontier.add(0);

    while (!frontier.isEmpty()) {
      int index = frontier.poll();
      JugState current = arena.get(index).state();

      if (current.holds(target)) {
        log.debug(
            "[Solver] Goal {} reached: X={}, Y={}, Z={}, explored={}",
            current, capacityX, capacityY, target, arena.size());
        return SolveResult.solved(reconstruct(arena, index));
      }

      for (JugAction action : JugAction.values()) {
        Optional<JugState> next = action.apply(current, capacityX, capacityY);
        if (next.isPresent() && visited.add(next.get())) {
          arena.add(new Node(next.get(), index, action));
          frontier.add(arena.size() - 1);
        }
      }
    }

    // unreachable while the feasibility check holds
    log.warn(
        "[Solver] Search exhausted after feasibility check passed: X={}, Y={}, Z={}, explored={}",
        capacityX, capacityY, target, arena.size());
    return SolveResult.unsolvable(UnsolvableReason.TARGET_NOT_REACHABLE);
  }

  private List<SolutionStep> reconstruct(List<Node> arena, int goalIndex) {
    Deque<Node> chain = new ArrayDeque<>();
    for (int i = goalIndex; arena.get(i).parent() != NO_PARENT; i = arena.get(i).parent()) {
      chain.push(arena.get(i));
    }

    List<SolutionStep> steps = new ArrayList<>(chain.size());
    int stepNumber = 1;
    for (Node node : chain) {
      boolean terminal = stepNumber == chain.size();
      steps.add(
          new SolutionStep(
              stepNumber, node.state().x(), node.state().y(), node.action().getLabel(), terminal));
      stepNumber++;
    }
    return steps;
  }

  /** Arena entry: a discovered state, its parent's arena index and the move that produced it. */
  private record Node(JugState state, int parent, JugAction action) {}
}
