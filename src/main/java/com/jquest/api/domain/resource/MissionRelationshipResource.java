package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.MissionRelationship;
import org.springframework.stereotype.Component;

@Component
public class MissionRelationshipResource extends ModelResource<MissionRelationship> {

    public MissionRelationshipResource() {
        super("mission_relationship", MissionRelationship.class);
        field(ResourceField.toOne("parent", "parent", "mission", false));
        field(ResourceField.toOne("mission", "mission", "mission", false));
    }
}
