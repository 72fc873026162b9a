package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Instance;

public interface InstanceRepository extends ResourceRepository<Instance> {

    @Override
    default Class<Instance> getEntityClass() {
        return Instance.class;
    }
}
