package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Progression;
import com.jquest.api.domain.model.Account;

import java.util.List;

public interface ProgressionRepository extends ResourceRepository<Progression> {

    @Override
    default Class<Progression> getEntityClass() {
        return Progression.class;
    }

    List<Progression> findByUser(Account user);
}
