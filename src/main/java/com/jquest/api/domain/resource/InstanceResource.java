package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.Instance;
import com.jquest.api.domain.repository.MissionRepository;
import org.springframework.stereotype.Component;

/**
 * The {@code instance} resource. Its missions are only rendered on the instance's own URI.
 */
@Component
public class InstanceResource extends ModelResource<Instance> {

    public InstanceResource(MissionRepository missionRepository) {
        super("instance", Instance.class);

        additionalDetailField(ResourceField.toMany("missions", "mission",
                bundle -> missionRepository.findByInstance(bundle.getObject()), true));

        filter("slug", FilterKind.EXACT);
        filter("name", FilterKind.EXACT);
        filter("host", FilterKind.EXACT);
        filter("missions__id", FilterKind.EXACT);

        alwaysReturnData();
    }
}
