package water.jug.controller.dto.waterjug;

/**
 * Body of {@code GET /api/waterjug/info}.
 *
 * @param sampleRequest a request the service can solve, for quick manual testing
 */
public record ApiInfoResponse(
    String name,
    String version,
    String description,
    Endpoints endpoints,
    SolveRequest sampleRequest) {

  public record Endpoints(String solve, String info, String health) {}
}
