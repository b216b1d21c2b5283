package water.jug.config;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * CORS settings.
 *
 * <p>The API is public and stateless, so the default is every origin without credentials. A
 * wildcard origin together with {@code allowCredentials=true} is rejected by Spring at request
 * time; list explicit origins when enabling credentials.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "cors")
public class CorsProperties {

  @NotEmpty(message = "cors.allowed-origins must list at least one origin")
  private List<String> allowedOrigins = List.of("*");

  @NotNull private Boolean allowCredentials = false;

  /** Preflight cache duration (seconds). */
  @NotNull private Long maxAge = 3600L;
}
