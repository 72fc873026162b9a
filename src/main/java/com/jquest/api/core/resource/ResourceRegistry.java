package com.jquest.api.core.resource;

import com.jquest.api.config.JquestProperties;
import com.jquest.api.core.domain.repository.ResourceRepository;
import com.jquest.api.exception.UnknownResourceException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds every published resource and the repository behind it.
 * Binds each resource to the configured API namespace at startup.
 */
@Component
public class ResourceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ResourceRegistry.class);

    private final List<ModelResource<?>> resources;
    private final List<ResourceRepository<?>> repositories;
    private final JquestProperties properties;
    private final Map<String, ModelResource<?>> resourceMap = new LinkedHashMap<>();
    private final Map<Class<?>, ResourceRepository<?>> repositoryMap = new ConcurrentHashMap<>();

    public ResourceRegistry(List<ModelResource<?>> resources,
                            List<ResourceRepository<?>> repositories,
                            JquestProperties properties) {
        this.resources = resources;
        this.repositories = repositories;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        String prefix = properties.getApi().getPrefix();
        String apiName = properties.getApi().getName();
        logger.info("Initializing ResourceRegistry for namespace {}/{}", prefix, apiName);

        for (ResourceRepository<?> repository : repositories) {
            repositoryMap.put(repository.getEntityClass(), repository);
        }

        for (ModelResource<?> resource : resources) {
            String name = resource.getResourceName();
            if (resourceMap.containsKey(name)) {
                logger.warn("Duplicate resource name found: {}. Existing: {}, New: {}",
                        name, resourceMap.get(name).getClass().getName(), resource.getClass().getName());
            }
            if (!repositoryMap.containsKey(resource.getEntityClass())) {
                throw new IllegalStateException("No repository found for entity "
                        + resource.getEntityClass().getName() + " of resource " + name);
            }
            resource.bind(prefix, apiName);
            resourceMap.put(name, resource);
            logger.info("Registered resource: {} -> {}", name, resource.getEntityClass().getSimpleName());
        }

        logger.info("ResourceRegistry initialized with {} resources", resourceMap.size());
    }

    public Optional<ModelResource<?>> findResource(String name) {
        return Optional.ofNullable(resourceMap.get(name));
    }

    /**
     * Looks up a resource by its published name.
     * @throws UnknownResourceException when no resource has that name
     */
    public ModelResource<?> getResource(String name) {
        return findResource(name).orElseThrow(() -> new UnknownResourceException(name));
    }

    public Collection<ModelResource<?>> getResources() {
        return Collections.unmodifiableCollection(resourceMap.values());
    }

    @SuppressWarnings("unchecked")
    public <T> ResourceRepository<T> getRepository(ModelResource<T> resource) {
        ResourceRepository<?> repository = repositoryMap.get(resource.getEntityClass());
        if (repository == null) {
            throw new IllegalStateException("No repository registered for " + resource.getEntityClass().getName());
        }
        return (ResourceRepository<T>) repository;
    }
}
