package water.jug.controller.dto.waterjug;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import water.jug.controller.validation.TargetWithinLargerJug;
import water.jug.domain.JugPuzzle;

/**
 * Solve request. Missing fields bind to {@code 0} and are then reported by validation.
 *
 * @param xCapacity capacity of bucket X (positive)
 * @param yCapacity capacity of bucket Y (positive)
 * @param zAmountWanted amount wanted in either bucket (0 to max(X, Y))
 */
@TargetWithinLargerJug
public record SolveRequest(
    @JsonProperty("xCapacity")
        @Schema(description = "Capacity of bucket X", example = "2")
        @Positive(message = "X capacity must be a positive integer")
        int xCapacity,
    @JsonProperty("yCapacity")
        @Schema(description = "Capacity of bucket Y", example = "10")
        @Positive(message = "Y capacity must be a positive integer")
        int yCapacity,
    @JsonProperty("zAmountWanted")
        @Schema(description = "Amount wanted in either bucket", example = "4")
        @PositiveOrZero(message = "Target amount must be a non-negative integer")
        int zAmountWanted) {

  public JugPuzzle toPuzzle() {
    return new JugPuzzle(xCapacity, yCapacity, zAmountWanted);
  }
}
