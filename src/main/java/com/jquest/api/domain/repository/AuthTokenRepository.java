package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.AuthToken;

public interface AuthTokenRepository extends ResourceRepository<AuthToken> {

    @Override
    default Class<AuthToken> getEntityClass() {
        return AuthToken.class;
    }
}
