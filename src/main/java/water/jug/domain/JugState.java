package water.jug.domain;

/**
 * Current volumes of the two buckets.
 *
 * <p>Equality is defined by the two volumes only, so states reached along different paths
 * collapse into one visited entry.
 *
 * @param x volume in bucket X
 * @param y volume in bucket Y
 */
public record JugState(int x, int y) {

  public static final JugState EMPTY = new JugState(0, 0);

  public boolean holds(int amount) {
    return x == amount || y == amount;
  }

  @Override
  public String toString() {
    return "(" + x + ", " + y + ")";
  }
}
