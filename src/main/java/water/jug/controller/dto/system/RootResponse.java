package water.jug.controller.dto.system;

public record RootResponse(String message, String documentation, String health, String version) {}
