package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Account;

import java.util.Optional;

public interface AccountRepository extends ResourceRepository<Account> {

    @Override
    default Class<Account> getEntityClass() {
        return Account.class;
    }

    Optional<Account> findByUsername(String username);
}
