package water.jug.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.concurrent.TimeUnit;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {

  /** Solved puzzles keyed by {@link water.jug.domain.JugPuzzle}. */
  public static final String JUG_SOLUTIONS = "jugSolutions";

  @Bean
  public CacheManager cacheManager(SolutionCacheProperties properties) {
    CaffeineCacheManager manager = new CaffeineCacheManager();

    manager.registerCustomCache(
        JUG_SOLUTIONS,
        Caffeine.newBuilder()
            .expireAfterWrite(properties.getExpireAfterWriteMinutes(), TimeUnit.MINUTES)
            .expireAfterAccess(properties.getExpireAfterAccessMinutes(), TimeUnit.MINUTES)
            .maximumSize(properties.getMaximumSize())
            .recordStats()
            .build());

    return manager;
  }
}
