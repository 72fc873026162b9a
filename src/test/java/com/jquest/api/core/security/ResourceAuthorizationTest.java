package com.jquest.api.core.security;

import com.jquest.api.config.JquestProperties;
import com.jquest.api.core.resource.TestResources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResourceAuthorization Tests")
class ResourceAuthorizationTest {

    private JquestProperties properties;
    private ResourceAuthorization authorization;
    private TestResources resources;

    @BeforeEach
    void setUp() {
        properties = new JquestProperties();
        authorization = new ResourceAuthorization(properties);
        resources = new TestResources();
        resources.registry();
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    private static void authenticate(String username, String... authorities) {
        SecurityContextHolder.getContext().setAuthentication(UsernamePasswordAuthenticationToken.authenticated(
            username, null, AuthorityUtils.createAuthorityList(authorities)));
    }

    @Test
    @DisplayName("Should let any authenticated account read")
    void shouldAllowReads() {
        // Given
        authenticate("player");

        // When & Then
        assertThatCode(() -> authorization.checkRead(resources.missions)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should refuse anonymous callers")
    void shouldRefuseAnonymous() {
        // Given
        SecurityContextHolder.getContext().setAuthentication(new AnonymousAuthenticationToken(
            "key", "anonymousUser", AuthorityUtils.createAuthorityList("ROLE_ANONYMOUS")));

        // When & Then
        assertThatThrownBy(() -> authorization.checkRead(resources.missions))
            .isInstanceOf(AuthenticationCredentialsNotFoundException.class);
    }

    @Test
    @DisplayName("Should require the matching model permission for writes")
    void shouldCheckPermissions() {
        // Given
        authenticate("editor", "mission.change");

        // When & Then
        assertThatCode(() -> authorization.checkUpdate(resources.missions)).doesNotThrowAnyException();
        assertThatThrownBy(() -> authorization.checkCreate(resources.missions))
            .isInstanceOf(AccessDeniedException.class)
            .hasMessageContaining("mission.add");
        assertThatThrownBy(() -> authorization.checkDelete(resources.instances))
            .isInstanceOf(AccessDeniedException.class)
            .hasMessageContaining("instance.delete");
    }

    @Test
    @DisplayName("Should let superusers write anything")
    void shouldAllowSuperuser() {
        // Given
        authenticate("admin", AccountUserDetailsService.ROLE_SUPERUSER);

        // When & Then
        assertThatCode(() -> authorization.checkDelete(resources.accounts)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should skip every check when security is disabled")
    void shouldSkipWhenDisabled() {
        // Given
        properties.getSecurity().setEnabled(false);

        // When & Then
        assertThatCode(() -> authorization.checkCreate(resources.missions)).doesNotThrowAnyException();
    }
}
