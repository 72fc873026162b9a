package com.jquest.api.util;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Objects;
import java.util.Optional;

public class Context {

  private Context() {
  }

  /**
   * @return the authenticated caller, empty for anonymous requests
   */
  public static Optional<Authentication> getAuthentication() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

    if (Objects.isNull(authentication)
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken) {
      return Optional.empty();
    }
    return Optional.of(authentication);
  }

  public static String getCurrentUsername() {
    return getAuthentication().map(Authentication::getName).orElse(null);
  }
}
