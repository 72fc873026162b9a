package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.Mission;
import com.jquest.api.domain.repository.MissionRelationshipRepository;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * The {@code mission} resource. The image path is rendered as an absolute URL on the requested host.
 */
@Component
public class MissionResource extends ModelResource<Mission> {

    public MissionResource(MissionRelationshipRepository relationshipRepository) {
        super("mission", Mission.class);
        field(ResourceField.toOne("instance", "instance", "instance", false));
        field(ResourceField.toMany("relationships", "mission_relationship",
                bundle -> relationshipRepository.findByMission(bundle.getObject()), true));

        override("image", bundle -> {
            Object image = bundle.get("image");
            return image != null && StringUtils.hasLength(image.toString())
                    ? bundle.getRequest().buildAbsoluteUri(image.toString())
                    : null;
        });

        filter("name", FilterKind.EXACT);
        filter("instance", FilterKind.EXACT);

        alwaysReturnData();
    }
}
