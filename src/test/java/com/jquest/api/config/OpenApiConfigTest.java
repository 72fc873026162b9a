package com.jquest.api.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OpenApiConfig Tests")
class OpenApiConfigTest {

    private final OpenApiConfig config = new OpenApiConfig();

    @Test
    @DisplayName("Should require HTTP Basic on every operation when security is enabled")
    void shouldRequireBasicAuth() {
        // Given
        JquestProperties properties = new JquestProperties();

        // When
        OpenAPI document = config.jquestOpenAPI(properties);

        // Then
        assertThat(document.getSecurity()).hasSize(1);
        assertThat(document.getSecurity().get(0)).containsKey(OpenApiConfig.BASIC_AUTH);
        SecurityScheme scheme = document.getComponents().getSecuritySchemes().get(OpenApiConfig.BASIC_AUTH);
        assertThat(scheme.getType()).isEqualTo(SecurityScheme.Type.HTTP);
        assertThat(scheme.getScheme()).isEqualTo("basic");
    }

    @Test
    @DisplayName("Should not require credentials when security is disabled")
    void shouldNotRequireBasicAuthWhenDisabled() {
        // Given
        JquestProperties properties = new JquestProperties();
        properties.getSecurity().setEnabled(false);

        // When
        OpenAPI document = config.jquestOpenAPI(properties);

        // Then
        assertThat(document.getSecurity()).isNullOrEmpty();
        assertThat(document.getComponents().getSecuritySchemes()).containsKey(OpenApiConfig.BASIC_AUTH);
    }

    @Test
    @DisplayName("Should describe the API from the configured properties")
    void shouldUseConfiguredInfo() {
        // Given
        JquestProperties properties = new JquestProperties();
        properties.getOpenapi().setTitle("Quest API");
        properties.getApi().setName("v2");

        // When
        OpenAPI document = config.jquestOpenAPI(properties);

        // Then
        assertThat(document.getInfo().getTitle()).isEqualTo("Quest API");
        assertThat(document.getInfo().getLicense().getName()).isEqualTo("LGPL-3.0");
        assertThat(document.getServers().get(0).getDescription()).isEqualTo("Resources under /api/v2");
    }
}
