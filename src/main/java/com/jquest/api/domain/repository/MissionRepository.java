package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Mission;
import com.jquest.api.domain.model.Instance;

import java.util.List;

public interface MissionRepository extends ResourceRepository<Mission> {

    @Override
    default Class<Mission> getEntityClass() {
        return Mission.class;
    }

    List<Mission> findByInstance(Instance instance);
}
