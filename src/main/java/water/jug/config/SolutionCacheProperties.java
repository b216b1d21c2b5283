package water.jug.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Caffeine settings for the {@code jugSolutions} cache.
 *
 * <pre>
 * waterjug:
 *   cache:
 *     expire-after-write-minutes: 60
 *     expire-after-access-minutes: 30
 *     maximum-size: 10000
 * </pre>
 *
 * @see CacheConfig
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "waterjug.cache")
public class SolutionCacheProperties {

  /** Absolute lifetime of an entry. */
  @Min(1)
  @Max(1440)
  private int expireAfterWriteMinutes = 60;

  /** Entries idle this long are evicted before their absolute lifetime ends. */
  @Min(1)
  @Max(1440)
  private int expireAfterAccessMinutes = 30;

  @Min(1)
  @Max(1_000_000)
  private long maximumSize = 10_000;
}
