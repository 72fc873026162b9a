package com.jquest.api.domain.resource;

import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.domain.model.Post;
import org.springframework.stereotype.Component;

@Component
public class PostResource extends ModelResource<Post> {

    public PostResource() {
        super("post", Post.class);
        readonly("created_at");
        field(ResourceField.toOne("language", "language", "language", false).withNullable(true));
        alwaysReturnData();
    }
}
