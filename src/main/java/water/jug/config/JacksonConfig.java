package water.jug.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Strict integer binding for request bodies.
 *
 * <p>Bucket volumes are whole numbers. Jackson would otherwise truncate {@code 2.9} to {@code 2}
 * and parse {@code "2"} as {@code 2}; both are rejected here and surface as a malformed request.
 */
@Configuration
public class JacksonConfig {

  @Bean
  public Jackson2ObjectMapperBuilderCustomizer strictIntegerCustomizer() {
    return builder ->
        builder
            .featuresToDisable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .postConfigurer(
                objectMapper ->
                    objectMapper
                        .coercionConfigFor(LogicalType.Integer)
                        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                        .setCoercion(CoercionInputShape.String, CoercionAction.Fail));
  }
}
