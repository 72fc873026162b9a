package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Language;

public interface LanguageRepository extends ResourceRepository<Language> {

    @Override
    default Class<Language> getEntityClass() {
        return Language.class;
    }
}
