package com.fieldforce.fieldexecutionbackend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.parameters.HeaderParameter;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI fieldExecutionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Field Execution Backend API")
                        .description("""
                                Execution engine for a field agent's working day.

                                This API provides endpoints for:
                                - **Routes**: Start and end the day, check into stops, add unplanned stops
                                - **Visits**: Gated activities, captured media, finalize and skip
                                - **Transfers**: Loading check, transit, arrival, handoff and return

                                **Real-time Updates**: Route boards and transfer details are pushed on
                                `/topic/routes/{routeId}` and `/topic/transfers/{transferId}` over the `/ws` STOMP endpoint.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Field Operations IT Team")
                                .email("support@fieldforce.example"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .components(new Components()
                        .addParameters("agentId", new HeaderParameter()
                                .name("X-Agent-Id")
                                .required(true)
                                .description("Identifier of the field agent driving the session")
                                .schema(new StringSchema())));
    }
}
