package water.jug.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class CorsConfig implements WebMvcConfigurer {

  private final CorsProperties corsProperties;

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    registry
        .addMapping("/**")
        .allowedOrigins(corsProperties.getAllowedOrigins().toArray(String[]::new))
        .allowedMethods("*")
        .allowedHeaders("*")
        .allowCredentials(corsProperties.getAllowCredentials())
        .maxAge(corsProperties.getMaxAge());
  }
}
