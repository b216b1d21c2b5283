package water.jug.domain;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UnsolvableReason {
  TARGET_EXCEEDS_CAPACITIES("target exceeds both capacities"),
  TARGET_NOT_REACHABLE("target not reachable");

  private final String description;
}
