package water.jug.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.info.License;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.context.annotation.Configuration;

@Configuration
@OpenAPIDefinition(
    info =
        @Info(
            title = "Water Jug Challenge API",
            version = "v1",
            description =
                "RESTful API to solve the classic Water Jug Riddle using an optimal BFS algorithm\n\n"
                    + "## Endpoints\n"
                    + "- **POST /api/waterjug/solve**: shortest list of moves, or no solution\n"
                    + "- **GET /api/waterjug/info**: API metadata and a sample request\n"
                    + "- **GET /health**: liveness summary",
            license = @License(name = "MIT License", url = "https://opensource.org/licenses/MIT")),
    servers = {@Server(url = "http://localhost:8080", description = "Local Development")})
public class OpenApiConfig {}
