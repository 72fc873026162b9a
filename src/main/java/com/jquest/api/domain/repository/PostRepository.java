package com.jquest.api.domain.repository;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.domain.model.Post;

public interface PostRepository extends ResourceRepository<Post> {

    @Override
    default Class<Post> getEntityClass() {
        return Post.class;
    }
}
