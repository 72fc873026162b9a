package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.AuthToken;
import org.springframework.stereotype.Component;

@Component
public class AuthTokenResource extends ModelResource<AuthToken> {

    public AuthTokenResource() {
        super("user_token", AuthToken.class);
        readonly("created_at");
        field(ResourceField.toOne("user", "user", "user", true));

        filter("user", FilterKind.EXACT_WITH_RELATIONS);
        filter("token", FilterKind.EXACT);
        filter("created_at", FilterKind.EXACT);

        alwaysReturnData();
    }
}
