package water.jug.domain;

/**
 * One puzzle instance. Also the key of the solution cache.
 *
 * @param capacityX capacity of bucket X
 * @param capacityY capacity of bucket Y
 * @param target amount wanted in either bucket
 */
public record JugPuzzle(int capacityX, int capacityY, int target) {

  @Override
  public String toString() {
    return "X=" + capacityX + ", Y=" + capacityY + ", Z=" + target;
  }
}
