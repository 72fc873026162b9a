package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.OAuthLink;
import com.jquest.api.domain.model.Account;

import java.util.List;

public interface OAuthLinkRepository extends ResourceRepository<OAuthLink> {

    @Override
    default Class<OAuthLink> getEntityClass() {
        return OAuthLink.class;
    }

    List<OAuthLink> findByUser(Account user);
}
