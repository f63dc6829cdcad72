package co.fanki.markupgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Markup Graph service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Markup Graph API")
                        .description("""
                                Markup Graph - builds the structure, script and style graph
                                of an HTML document.

                                ## Node kinds
                                - **element**, **inline-style**: the markup tree
                                - **script**, **function**, **input**, **output**, **variable**,
                                  **dom-change**: static extraction from inline scripts
                                - **stylesheet**, **external-style**: style sheets, linked to the
                                  elements their selectors match

                                ## Endpoints
                                - `POST /api/analysis` - full graph
                                - `POST /api/analysis/query` - colon-separated graph query
                                - `POST /api/analysis/summary` - counts per node and edge kind
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
