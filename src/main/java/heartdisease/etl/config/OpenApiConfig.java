package heartdisease.etl.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the run API
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI etlOpenAPI(@Value("${server.port:8080}") int port) {
        Server localServer = new Server();
        localServer.setUrl("http://localhost:" + port);
        localServer.setDescription("Local Development Server");

        Info info = new Info()
                .title("Heart Disease ETL API")
                .version("1.0.0")
                .description("Triggers and inspects runs of the UCI Heart Disease extract-transform-load pipeline");

        return new OpenAPI()
                .info(info)
                .servers(List.of(localServer));
    }
}
