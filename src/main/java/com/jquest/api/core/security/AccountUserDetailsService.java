package com.jquest.api.core.security;

import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads accounts for HTTP Basic authentication.
 * Authorities are the account's model permissions plus its staff and superuser roles.
 */
@Service
public class AccountUserDetailsService implements UserDetailsService {

    public static final String ROLE_STAFF = "ROLE_STAFF";
    public static final String ROLE_SUPERUSER = "ROLE_SUPERUSER";

    private static final Logger logger = LoggerFactory.getLogger(AccountUserDetailsService.class);

    private final AccountRepository accountRepository;

    public AccountUserDetailsService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String username) {
        Account account = accountRepository.findByUsername(username)
                .orElseThrow(() -> {
                    logger.debug("Authentication attempt for unknown account {}", username);
                    return new UsernameNotFoundException("Unknown account: " + username);
                });

        return User.withUsername(account.getUsername())
                .password(account.getPassword())
                .disabled(!Boolean.TRUE.equals(account.getIsActive()))
                .authorities(authoritiesOf(account))
                .build();
    }

    static List<GrantedAuthority> authoritiesOf(Account account) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        account.getPermissions().forEach(permission -> authorities.add(new SimpleGrantedAuthority(permission)));
        if (Boolean.TRUE.equals(account.getIsStaff())) {
            authorities.add(new SimpleGrantedAuthority(ROLE_STAFF));
        }
        if (Boolean.TRUE.equals(account.getIsSuperuser())) {
            authorities.add(new SimpleGrantedAuthority(ROLE_SUPERUSER));
        }
        return authorities;
    }
}
