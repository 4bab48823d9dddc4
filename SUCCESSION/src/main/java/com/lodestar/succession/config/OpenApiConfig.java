package com.lodestar.succession.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation configuration for the SUCCESSION service.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8090}")
    private int serverPort;

    @Bean
    public OpenAPI successionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LODESTAR Succession Service API")
                        .description("""
                                SUCCESSION runs the leadership pipeline of a chapter.

                                ## Features

                                - **Cycles**: 12-stage lifecycle with guarded transitions and deadline automation
                                - **Candidacies**: Nominations, self-applications and consent-based secondments
                                - **Evaluation**: Weighted rubrics, evaluator recusal and ranked totals
                                - **Interviews and voting**: Panel feedback, committee ballots and quorum

                                ## Identity

                                Every request carries `X-Actor-Id` and, for administrators, `X-Actor-Roles: ADMIN`.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("LODESTAR Team"))
                        .license(new License()
                                .name("Apache 2.0")
                                .url("https://www.apache.org/licenses/LICENSE-2.0")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ))
                .tags(List.of(
                        new Tag().name("Cycles").description("Cycle administration and stage transitions"),
                        new Tag().name("Candidacies").description("Nominations, applications and secondments"),
                        new Tag().name("Evaluation").description("Rubrics, evaluator assignment and scoring"),
                        new Tag().name("Interviews").description("Interview slots and panel feedback"),
                        new Tag().name("Voting").description("Committee ballots and selections"),
                        new Tag().name("Audit").description("Audit trail export")
                ));
    }
}
