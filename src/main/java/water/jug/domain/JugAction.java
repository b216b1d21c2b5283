package water.jug.domain;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The six moves available from any state.
 *
 * <p>Declaration order is the successor order used by the solver. Changing it changes which of
 * several equally short solutions is returned.
 */
@Getter
@RequiredArgsConstructor
public enum JugAction {
  FILL_X("Fill bucket X") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.x() >= capacityX) {
        return Optional.empty();
      }
      return Optional.of(new JugState(capacityX, from.y()));
    }
  },

  FILL_Y("Fill bucket Y") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.y() >= capacityY) {
        return Optional.empty();
      }
      return Optional.of(new JugState(from.x(), capacityY));
    }
  },

  EMPTY_X("Empty bucket X") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.x() <= 0) {
        return Optional.empty();
      }
      return Optional.of(new JugState(0, from.y()));
    }
  },

  EMPTY_Y("Empty bucket Y") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.y() <= 0) {
        return Optional.empty();
      }
      return Optional.of(new JugState(from.x(), 0));
    }
  },

  TRANSFER_X_TO_Y("Transfer from bucket X to Y") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.x() <= 0 || from.y() >= capacityY) {
        return Optional.empty();
      }
      int amount = Math.min(from.x(), capacityY - from.y());
      return Optional.of(new JugState(from.x() - amount, from.y() + amount));
    }
  },

  TRANSFER_Y_TO_X("Transfer from bucket Y to X") {
    @Override
    public Optional<JugState> apply(JugState from, int capacityX, int capacityY) {
      if (from.y() <= 0 || from.x() >= capacityX) {
        return Optional.empty();
      }
      int amount = Math.min(from.y(), capacityX - from.x());
      return Optional.of(new JugState(from.x() + amount, from.y() - amount));
    }
  };

  private final String label;

  /**
   * Applies this move to {@code from}.
   *
   * @return the resulting state, or empty when the move is not allowed (filling a full bucket,
   *     emptying an empty one, pouring from empty or into full)
   */
  public abstract Optional<JugState> apply(JugState from, int capacityX, int capacityY);

  public static Optional<JugAction> fromLabel(String label) {
    return Arrays.stream(values()).filter(action -> action.label.equals(label)).findFirst();
  }
}
