package water.jug.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the typed configuration classes.
 *
 * <h3>Configuration in application.yml</h3>
 *
 * <pre>
 * waterjug:
 *   api:
 *     name: Water Jug Challenge API
 *     version: 1.0.0
 *   cache:
 *     expire-after-write-minutes: 60
 * cors:
 *   allowed-origins: ["*"]
 * </pre>
 */
@Configuration
@EnableConfigurationProperties({
  ApiInfoProperties.class,
  SolutionCacheProperties.class,
  CorsProperties.class
})
public class PropertiesConfig {}
