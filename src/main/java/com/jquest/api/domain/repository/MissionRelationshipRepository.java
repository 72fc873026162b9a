package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.MissionRelationship;
import com.jquest.api.domain.model.Mission;

import java.util.List;

public interface MissionRelationshipRepository extends ResourceRepository<MissionRelationship> {

    @Override
    default Class<MissionRelationship> getEntityClass() {
        return MissionRelationship.class;
    }

    List<MissionRelationship> findByMission(Mission mission);
}
