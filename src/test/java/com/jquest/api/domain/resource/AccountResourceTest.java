package com.jquest.api.domain.resource;

import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.repository.OAuthLinkRepository;
import com.jquest.api.domain.repository.ProgressionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("AccountResource Tests")
class AccountResourceTest {

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder();
    private AccountResource resource;

    @BeforeEach
    void setUp() {
        resource = new AccountResource(mock(ProgressionRepository.class), mock(OAuthLinkRepository.class),
            passwordEncoder);
    }

    @Test
    @DisplayName("Should accept a single oauth object or a list of them")
    void shouldAcceptOAuthShapes() {
        // Given
        Map<String, Object> single = Map.of("username", "alice",
            "oauths", Map.of("consumer", "github", "consumer_user_id", "1"));
        Map<String, Object> many = Map.of("username", "alice",
            "oauths", List.of(
                Map.of("consumer", "github", "consumer_user_id", "1"),
                Map.of("consumer", "facebook", "consumer_user_id", 2)));

        // Then
        assertThat(resource.validate(single)).isEmpty();
        assertThat(resource.validate(many)).isEmpty();
        assertThat(resource.validate(Map.of("username", "alice"))).isEmpty();
    }

    @Test
    @DisplayName("Should reject oauths that are neither an object nor a list of objects")
    void shouldRejectMalformedOAuths() {
        // Then
        assertThat(resource.validate(Map.of("oauths", "github:1")))
            .containsExactly("The 'oauths' field must be an object or a list of objects");
        assertThat(resource.validate(Map.of("oauths", List.of("github"))))
            .containsExactly("The 'oauths[0]' entry must be an object");
        assertThat(resource.validate(Map.of("oauths", Map.of("consumer", "github"))))
            .containsExactly("The 'oauths' entry has no 'consumer_user_id'");
    }

    @Test
    @DisplayName("Should store the given password encoded")
    void shouldEncodePassword() {
        // Given
        Account account = new Account("alice");

        // When
        resource.beforeSave(account, Map.of("password", "s3cret"));

        // Then
        assertThat(account.getPassword()).isNotEqualTo("s3cret");
        assertThat(passwordEncoder.matches("s3cret", account.getPassword())).isTrue();
    }

    @Test
    @DisplayName("Should give accounts created without a password an unusable one")
    void shouldSetUnusablePassword() {
        // Given
        Account account = new Account("bob");

        // When
        resource.beforeSave(account, Map.of());

        // Then
        assertThat(account.getPassword()).startsWith(AccountResource.UNUSABLE_PASSWORD_PREFIX);
    }

    @Test
    @DisplayName("Should keep the stored password when an update does not change it")
    void shouldKeepPasswordOnUpdate() {
        // Given
        Account account = new Account("carol");
        account.setPassword("stored-hash");

        // When
        resource.beforeSave(account, Map.of("first_name", "Carol"));

        // Then
        assertThat(account.getPassword()).isEqualTo("stored-hash");
    }
}
