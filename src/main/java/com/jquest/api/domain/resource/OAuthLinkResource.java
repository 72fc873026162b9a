package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.OAuthLink;
import org.springframework.stereotype.Component;

/**
 * The {@code user_oauth} resource. The owning user is rendered in full.
 */
@Component
public class OAuthLinkResource extends ModelResource<OAuthLink> {

    public OAuthLinkResource() {
        super("user_oauth", OAuthLink.class);
        field(ResourceField.toOne("user", "user", "user", true));

        filter("consumer_user_id", FilterKind.EXACT);
        filter("consumer", FilterKind.EXACT);
        filter("user", FilterKind.EXACT_WITH_RELATIONS);

        alwaysReturnData();
    }
}
