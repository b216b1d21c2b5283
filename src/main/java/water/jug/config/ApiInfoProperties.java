package water.jug.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Static service metadata shown by the info, health and root endpoints.
 *
 * @param name service display name
 * @param version API version
 * @param description one-line description
 */
@Validated
@ConfigurationProperties(prefix = "waterjug.api")
public record ApiInfoProperties(
    @NotBlank @DefaultValue("Water Jug Challenge API") String name,
    @NotBlank @DefaultValue("1.0.0") String version,
    @DefaultValue("Solves the classic water jug riddle using optimal algorithms")
        String description) {}
