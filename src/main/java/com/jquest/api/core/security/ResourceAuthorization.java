package com.jquest.api.core.security;

import com.jquest.api.config.JquestProperties;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.util.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.stereotype.Component;

/**
 * Model-permission checks run before a resource operation.
 * Reads need an authenticated caller; writes need the {@code <resource>.add},
 * {@code <resource>.change} or {@code <resource>.delete} authority, which superusers hold implicitly.
 */
@Component
public class ResourceAuthorization {

    private static final Logger logger = LoggerFactory.getLogger(ResourceAuthorization.class);

    private final JquestProperties properties;

    public ResourceAuthorization(JquestProperties properties) {
        this.properties = properties;
    }

    public void checkRead(ModelResource<?> resource) {
        if (properties.getSecurity().isEnabled()) {
            requireAuthentication(resource);
        }
    }

    public void checkCreate(ModelResource<?> resource) {
        checkPermission(resource, "add");
    }

    public void checkUpdate(ModelResource<?> resource) {
        checkPermission(resource, "change");
    }

    public void checkDelete(ModelResource<?> resource) {
        checkPermission(resource, "delete");
    }

    /**
     * Name of the authority that grants an action on a resource, e.g. {@code mission.add}.
     */
    public static String permissionName(ModelResource<?> resource, String action) {
        return resource.getResourceName() + "." + action;
    }

    private void checkPermission(ModelResource<?> resource, String action) {
        if (!properties.getSecurity().isEnabled()) {
            return;
        }
        Authentication authentication = requireAuthentication(resource);
        String permission = permissionName(resource, action);
        boolean granted = authentication.getAuthorities().stream()
                .map(GrantedAuthority::getAuthority)
                .anyMatch(authority -> authority.equals(permission)
                        || authority.equals(AccountUserDetailsService.ROLE_SUPERUSER));
        if (!granted) {
            logger.warn("Account {} lacks permission {}", authentication.getName(), permission);
            throw new AccessDeniedException("Missing permission " + permission);
        }
    }

    private Authentication requireAuthentication(ModelResource<?> resource) {
        return Context.getAuthentication().orElseThrow(() -> {
            logger.debug("Anonymous access to resource {} refused", resource.getResourceName());
            return new AuthenticationCredentialsNotFoundException("Authentication required");
        });
    }
}
