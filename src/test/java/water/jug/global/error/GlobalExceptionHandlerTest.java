package water.jug.global.error;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import water.jug.global.error.exception.InvalidJugConfigurationException;

@Tag("unit")
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new FailingController())
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
  }

  @Test
  @DisplayName("Business exceptions keep their code, status and formatted message")
  void handleBaseException() throws Exception {
    mockMvc
        .perform(get("/test/invalid-configuration"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value(400))
        .andExpect(jsonPath("$.code").value("C003"))
        .andExpect(jsonPath("$.error").value("Invalid jug configuration"))
        .andExpect(
            jsonPath("$.message")
                .value(
                    "Capacities must be positive and the target non-negative (X=0, Y=5, Z=3)"))
        .andExpect(jsonPath("$.validationErrors").doesNotExist())
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  @DisplayName("Unexpected exceptions become a 500 without internal detail")
  void handleUnexpectedException() throws Exception {
    mockMvc
        .perform(get("/test/unexpected"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("S001"))
        .andExpect(jsonPath("$.message").value("An error occurred while processing your request"))
        .andExpect(jsonPath("$.timestamp").exists());
  }

  @Test
  @DisplayName("Unsupported HTTP method is a 405")
  void handleMethodNotSupported() throws Exception {
    mockMvc
        .perform(post("/test/unexpected"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.code").value("C005"))
        .andExpect(jsonPath("$.message").value("Method POST is not supported"));
  }

  @Test
  @DisplayName("Unsupported content type is a 415")
  void handleMediaTypeNotSupported() throws Exception {
    mockMvc
        .perform(post("/test/echo").contentType(MediaType.TEXT_PLAIN).content("hello"))
        .andExpect(status().isUnsupportedMediaType())
        .andExpect(jsonPath("$.code").value("C006"));
  }

  @RestController
  static class FailingController {

    @GetMapping("/test/invalid-configuration")
    String invalidConfiguration() {
      throw new InvalidJugConfigurationException(0, 5, 3);
    }

    @GetMapping("/test/unexpected")
    String unexpected() {
      throw new IllegalStateException("secret internal detail");
    }

    @PostMapping("/test/echo")
    Echo echo(@RequestBody Echo body) {
      return body;
    }
  }

  record Echo(String value) {}
}
