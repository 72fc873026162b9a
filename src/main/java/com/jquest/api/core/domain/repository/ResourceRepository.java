package com.jquest.api.core.domain.repository;

import jakarta.persistence.EntityNotFoundException;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

/**
 * Base repository for every entity published as a resource.
 * Extends JpaRepository and JpaSpecificationExecutor so resources can be listed with filters.
 * @param <T> the entity type
 */
@NoRepositoryBean
public interface ResourceRepository<T> extends JpaRepository<T, Long>, JpaSpecificationExecutor<T> {

    /**
     * Returns the entity class managed by this repository.
     * @return the entity class
     */
    Class<T> getEntityClass();

    /**
     * Loads an entity or fails with {@link EntityNotFoundException}.
     * @param id the entity id
     * @return the entity
     */
    default T getRequired(Long id) {
        return findById(id).orElseThrow(() ->
                new EntityNotFoundException(getEntityClass().getSimpleName() + " not found with id: " + id));
    }
}
