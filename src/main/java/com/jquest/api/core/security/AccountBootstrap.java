package com.jquest.api.core.security;

import com.jquest.api.config.JquestProperties;
import com.jquest.api.domain.model.Account;
import com.jquest.api.domain.repository.AccountRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Creates the configured superuser on startup so a fresh database can be administered through the API.
 */
@Component
public class AccountBootstrap implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(AccountBootstrap.class);

    private final JquestProperties properties;
    private final AccountRepository accountRepository;
    private final PasswordEncoder passwordEncoder;

    public AccountBootstrap(JquestProperties properties, AccountRepository accountRepository,
                            PasswordEncoder passwordEncoder) {
        this.properties = properties;
        this.accountRepository = accountRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        JquestProperties.Security security = properties.getSecurity();
        String username = security.getBootstrapUsername();
        if (!StringUtils.hasText(username) || !StringUtils.hasText(security.getBootstrapPassword())) {
            return;
        }
        if (accountRepository.findByUsername(username).isPresent()) {
            logger.debug("Bootstrap account {} already exists", username);
            return;
        }
        Account account = new Account(username);
        account.setPassword(passwordEncoder.encode(security.getBootstrapPassword()));
        account.setIsStaff(true);
        account.setIsSuperuser(true);
        accountRepository.save(account);
        logger.info("Created bootstrap superuser {}", username);
    }
}
