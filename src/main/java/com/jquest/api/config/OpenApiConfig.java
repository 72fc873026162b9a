package com.jquest.api.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document of the resource API.
 * Every operation requires HTTP Basic credentials unless security is switched off.
 */
@Configuration
public class OpenApiConfig {

    public static final String BASIC_AUTH = "basicAuth";

    @Bean
    public OpenAPI jquestOpenAPI(JquestProperties properties) {
        JquestProperties.OpenApi openapi = properties.getOpenapi();
        JquestProperties.Api api = properties.getApi();

        OpenAPI document = new OpenAPI()
            .info(new Info()
                .title(openapi.getTitle())
                .description(openapi.getDescription())
                .version(openapi.getVersion())
                .contact(new Contact()
                    .name(openapi.getContactName())
                    .email(openapi.getContactEmail()))
                .license(new License()
                    .name(openapi.getLicenseName())))
            .addServersItem(new Server()
                .url("/")
                .description("Resources under " + api.getPrefix() + "/" + api.getName()))
            .components(new Components()
                .addSecuritySchemes(BASIC_AUTH, new SecurityScheme()
                    .type(SecurityScheme.Type.HTTP)
                    .scheme("basic")
                    .description("Account username and password")));

        if (properties.getSecurity().isEnabled()) {
            document.addSecurityItem(new SecurityRequirement().addList(BASIC_AUTH));
        }
        return document;
    }
}
