package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.core.resource.ResourceHydrator;
import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.model.OAuthLink;
import com.jquest.api.domain.repository.OAuthLinkRepository;
import com.jquest.api.domain.repository.ProgressionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The {@code user} resource. Credentials and contact data are never published.
 *
 * <p>A create payload may carry an {@code oauths} entry, either one object or a list of
 * objects with {@code consumer} and {@code consumer_user_id}; each becomes an
 * {@link OAuthLink} owned by the new account. A {@code password} entry is stored encoded.</p>
 */
@Component
public class AccountResource extends ModelResource<Account> {

    private static final Logger logger = LoggerFactory.getLogger(AccountResource.class);

    public static final String OAUTHS = "oauths";
    public static final String PASSWORD = "password";

    /** Prefix of a stored password that can never match, as Django marks unusable passwords. */
    static final String UNUSABLE_PASSWORD_PREFIX = "!";

    private final OAuthLinkRepository oauthLinkRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountResource(ProgressionRepository progressionRepository,
                           OAuthLinkRepository oauthLinkRepository,
                           PasswordEncoder passwordEncoder) {
        super("user", Account.class, "password", "last_login", "email");
        this.oauthLinkRepository = oauthLinkRepository;
        this.passwordEncoder = passwordEncoder;

        additionalDetailField(ResourceField.toMany("progressions", "user_progression",
                bundle -> progressionRepository.findByUser(bundle.getObject()), true));

        filter("date_joined", FilterKind.EXACT);
        filter("first_name", FilterKind.EXACT);
        filter("id", FilterKind.EXACT);
        filter("is_active", FilterKind.EXACT);
        filter("is_staff", FilterKind.EXACT);
        filter("is_superuser", FilterKind.EXACT);
        filter("last_name", FilterKind.EXACT);
        filter(RESOURCE_URI, FilterKind.EXACT);
        filter("username", FilterKind.EXACT);

        alwaysReturnData();
    }

    @Override
    public List<String> validate(Map<String, Object> payload) {
        List<String> errors = new ArrayList<>();
        Object password = payload.get(PASSWORD);
        if (password != null && !(password instanceof String)) {
            errors.add("The 'password' field must be a string");
        }
        if (payload.containsKey(OAUTHS)) {
            Object oauths = payload.get(OAUTHS);
            if (oauths instanceof Map<?, ?> single) {
                validateOAuth(single, OAUTHS, errors);
            } else if (oauths instanceof Collection<?> many) {
                int index = 0;
                for (Object element : many) {
                    String label = OAUTHS + "[" + index++ + "]";
                    if (element instanceof Map<?, ?> map) {
                        validateOAuth(map, label, errors);
                    } else {
                        errors.add("The '" + label + "' entry must be an object");
                    }
                }
            } else {
                errors.add("The 'oauths' field must be an object or a list of objects");
            }
        }
        return errors;
    }

    private static void validateOAuth(Map<?, ?> oauth, String label, List<String> errors) {
        for (String key : List.of("consumer", "consumer_user_id")) {
            Object value = oauth.get(key);
            if (value == null || !StringUtils.hasText(value.toString())) {
                errors.add("The '" + label + "' entry has no '" + key + "'");
            }
        }
    }

    @Override
    public void beforeSave(Account account, Map<String, Object> payload) {
        Object password = payload.get(PASSWORD);
        if (password instanceof String raw && StringUtils.hasText(raw)) {
            account.setPassword(passwordEncoder.encode(raw));
        } else if (account.getPassword() == null) {
            account.setPassword(UNUSABLE_PASSWORD_PREFIX + UUID.randomUUID());
        }
    }

    @Override
    public void afterCreate(Account account, Map<String, Object> payload, ResourceHydrator hydrator) {
        Object oauths = payload.get(OAUTHS);
        if (oauths == null) {
            return;
        }
        ModelResource<OAuthLink> oauthResource = hydrator.getResource("user_oauth", OAuthLink.class);
        List<Map<?, ?>> entries = new ArrayList<>();
        if (oauths instanceof Map<?, ?> single) {
            entries.add(single);
        } else if (oauths instanceof Collection<?> many) {
            many.forEach(element -> entries.add((Map<?, ?>) element));
        }
        for (Map<?, ?> entry : entries) {
            OAuthLink link = new OAuthLink();
            hydrator.hydrate(oauthResource, link, toPayload(entry));
            link.setUser(account);
            oauthLinkRepository.save(link);
        }
        logger.info("Linked {} OAuth identities to account {}", entries.size(), account.getUsername());
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> toPayload(Map<?, ?> entry) {
        Map<String, Object> payload = new LinkedHashMap<>((Map<String, Object>) entry);
        payload.remove("user");
        return payload;
    }
}
