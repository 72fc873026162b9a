package com.jquest.api.core.service;

import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.core.domain.specification.FilterSpecificationBuilder;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.RequestContext;
import com.jquest.api.core.resource.ResourceHydrator;
import com.jquest.api.core.resource.ResourceProjector;
import com.jquest.api.core.resource.ResourceRegistry;
import com.jquest.api.core.security.ResourceAuthorization;
import com.jquest.api.exception.InvalidPayloadException;
import com.jquest.api.util.Context;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.lang.reflect.InvocationTargetException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CRUD operations over any registered resource.
 * Reads project entities inside the transaction so lazy relations can be rendered.
 * Writes validate the payload, hydrate the entity, save it and run the resource hooks.
 */
@Service
@Transactional
public class ResourceService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceService.class);

    private final ResourceRegistry registry;
    private final ResourceProjector projector;
    private final ResourceHydrator hydrator;
    private final ResourceAuthorization authorization;

    /**
     * Result of a write: the canonical URI of the written object and, when the resource
     * always returns data, its projection.
     */
    @Getter
    @AllArgsConstructor
    public static class WriteResult {
        private final String location;
        private final Map<String, Object> body;
    }

    public ResourceService(ResourceRegistry registry,
                           ResourceProjector projector,
                           ResourceHydrator hydrator,
                           ResourceAuthorization authorization) {
        this.registry = registry;
        this.projector = projector;
        this.hydrator = hydrator;
        this.authorization = authorization;
    }

    /**
     * Lists a resource with exact-match filters and pagination.
     * @param resourceName the published resource name
     * @param filters published filter key to raw value, may be empty
     * @param pageable pagination and sorting information
     * @param request the request being answered
     * @return a page of projected objects
     */
    @Transactional(readOnly = true)
    public Page<Map<String, Object>> list(String resourceName, Map<String, String> filters,
                                          Pageable pageable, RequestContext request) {
        return list(registry.getResource(resourceName), filters, pageable, request);
    }

    private <T> Page<Map<String, Object>> list(ModelResource<T> resource, Map<String, String> filters,
                                               Pageable pageable, RequestContext request) {
        authorization.checkRead(resource);
        ResourceRepository<T> repository = registry.getRepository(resource);

        Page<T> page;
        if (filters.isEmpty()) {
            page = repository.findAll(pageable);
        } else {
            Specification<T> spec = FilterSpecificationBuilder.build(filters, resource, registry);
            page = repository.findAll(spec, pageable);
        }
        logger.debug("Listing {} with filters {}: {} of {} objects", resource.getResourceName(), filters.keySet(),
                page.getNumberOfElements(), page.getTotalElements());
        return page.map(entity -> projector.project(entity, request, resource));
    }

    /**
     * Loads and projects one object.
     * @throws jakarta.persistence.EntityNotFoundException if no object has that id
     */
    @Transactional(readOnly = true)
    public Map<String, Object> detail(String resourceName, Long id, RequestContext request) {
        return detail(registry.getResource(resourceName), id, request);
    }

    private <T> Map<String, Object> detail(ModelResource<T> resource, Long id, RequestContext request) {
        authorization.checkRead(resource);
        T entity = registry.getRepository(resource).getRequired(id);
        return projector.project(entity, request, resource);
    }

    public WriteResult create(String resourceName, Map<String, Object> payload, RequestContext request) {
        return create(registry.getResource(resourceName), payload, request);
    }

    private <T> WriteResult create(ModelResource<T> resource, Map<String, Object> payload, RequestContext request) {
        authorization.checkCreate(resource);
        validate(resource, payload);

        T entity = newInstance(resource);
        hydrator.hydrate(resource, entity, payload);
        resource.beforeSave(entity, payload);
        T saved = registry.getRepository(resource).saveAndFlush(entity);
        resource.afterCreate(saved, payload, hydrator);

        String location = resource.getResourceUri(saved);
        logger.info("Created {} {} by {}", resource.getResourceName(), location, Context.getCurrentUsername());
        return writeResult(resource, saved, location, request);
    }

    public WriteResult update(String resourceName, Long id, Map<String, Object> payload, RequestContext request) {
        return update(registry.getResource(resourceName), id, payload, request);
    }

    private <T> WriteResult update(ModelResource<T> resource, Long id, Map<String, Object> payload,
                                   RequestContext request) {
        authorization.checkUpdate(resource);
        validate(resource, payload);

        ResourceRepository<T> repository = registry.getRepository(resource);
        T entity = repository.getRequired(id);
        hydrator.hydrate(resource, entity, payload);
        resource.beforeSave(entity, payload);
        T saved = repository.saveAndFlush(entity);

        String location = resource.getResourceUri(saved);
        logger.info("Updated {} {} by {}", resource.getResourceName(), location, Context.getCurrentUsername());
        return writeResult(resource, saved, location, request);
    }

    public void delete(String resourceName, Long id) {
        delete(registry.getResource(resourceName), id);
    }

    private <T> void delete(ModelResource<T> resource, Long id) {
        authorization.checkDelete(resource);
        ResourceRepository<T> repository = registry.getRepository(resource);
        repository.delete(repository.getRequired(id));
        logger.info("Deleted {} with id {} by {}", resource.getResourceName(), id, Context.getCurrentUsername());
    }

    /**
     * Describes a resource: fields, filtering and allowed methods.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> schema(String resourceName) {
        ModelResource<?> resource = registry.getResource(resourceName);
        authorization.checkRead(resource);
        return resource.getSchema();
    }

    /**
     * Lists every published resource with its list and schema endpoints.
     */
    @Transactional(readOnly = true)
    public Map<String, Object> index() {
        Map<String, Object> index = new LinkedHashMap<>();
        for (ModelResource<?> resource : registry.getResources()) {
            Map<String, Object> endpoints = new LinkedHashMap<>();
            endpoints.put("list_endpoint", resource.getListUri());
            endpoints.put("schema", resource.getSchemaUri());
            index.put(resource.getResourceName(), endpoints);
        }
        return index;
    }

    private <T> WriteResult writeResult(ModelResource<T> resource, T saved, String location, RequestContext request) {
        Map<String, Object> body = resource.isAlwaysReturnData()
                ? projector.project(saved, request, resource)
                : null;
        return new WriteResult(location, body);
    }

    private void validate(ModelResource<?> resource, Map<String, Object> payload) {
        List<String> errors = resource.validate(payload);
        if (!errors.isEmpty()) {
            logger.debug("Rejected payload for {}: {}", resource.getResourceName(), errors);
            throw new InvalidPayloadException(errors);
        }
    }

    private <T> T newInstance(ModelResource<T> resource) {
        try {
            return resource.getEntityClass().getDeclaredConstructor().newInstance();
        } catch (InstantiationException | IllegalAccessException | NoSuchMethodException
                 | InvocationTargetException e) {
            throw new IllegalStateException("Cannot instantiate " + resource.getEntityClass().getName(), e);
        }
    }
}
