package com.jquest.api.core.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jquest.api.exception.InvalidPayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes a request payload into an entity, the reverse of {@link ResourceProjector}.
 *
 * <p>Only writable base fields are considered, keyed by their published name. Unknown keys are
 * ignored. To-one fields accept a resource URI, a numeric id or an object carrying
 * {@code id} or {@code resource_uri}; to-many fields are read-only.</p>
 */
@Component
public class ResourceHydrator {
    private static final Logger logger = LoggerFactory.getLogger(ResourceHydrator.class);

    private final ResourceRegistry registry;
    private final ObjectMapper objectMapper;

    public ResourceHydrator(ResourceRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    /**
     * Looks up a resource and checks it publishes the expected entity type.
     */
    @SuppressWarnings("unchecked")
    public <T> ModelResource<T> getResource(String name, Class<T> entityClass) {
        ModelResource<?> resource = registry.getResource(name);
        if (!entityClass.equals(resource.getEntityClass())) {
            throw new IllegalArgumentException("Resource " + name + " publishes "
                    + resource.getEntityClass().getSimpleName() + ", not " + entityClass.getSimpleName());
        }
        return (ModelResource<T>) resource;
    }

    public <T> T hydrate(ModelResource<T> resource, T entity, Map<String, Object> payload) {
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(entity);
        for (ResourceField field : resource.getFields().values()) {
            if (field.isReadonly() || field.getExtractor() != null || !payload.containsKey(field.getName())) {
                continue;
            }
            Object value = payload.get(field.getName());
            switch (field.getKind()) {
                case ATTRIBUTE -> wrapper.setPropertyValue(field.getAttribute(),
                        convert(field, value, wrapper.getPropertyType(field.getAttribute())));
                case TO_ONE -> wrapper.setPropertyValue(field.getAttribute(), resolveRelated(field, value));
                case TO_MANY -> logger.debug("Ignoring read-only field {} on {}", field.getName(),
                        resource.getResourceName());
            }
        }
        return entity;
    }

    private Object convert(ResourceField field, Object value, Class<?> type) {
        if (value == null || type == null) {
            return value;
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new InvalidPayloadException(field.getName(),
                    "Invalid value for field '" + field.getName() + "': " + value);
        }
    }

    /**
     * Resolves the payload value of a to-one field to the related entity.
     * @return the related entity, or null when the value is null and the field allows it
     */
    public Object resolveRelated(ResourceField field, Object value) {
        if (value == null) {
            if (!field.isNullable()) {
                throw new InvalidPayloadException(field.getName(),
                        "The '" + field.getName() + "' field has no data and doesn't allow a null value");
            }
            return null;
        }
        ModelResource<?> related = registry.getResource(field.getRelatedResource());
        Long id = toId(field, related, value);
        return registry.getRepository(related).findById(id)
                .orElseThrow(() -> new InvalidPayloadException(field.getName(),
                        "Could not find the provided object via resource URI '" + value + "'"));
    }

    private Long toId(ResourceField field, ModelResource<?> related, Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof Map<?, ?> map) {
            if (map.get("id") != null) {
                return toId(field, related, map.get("id"));
            }
            return toId(field, related, map.get(ModelResource.RESOURCE_URI));
        }
        if (value instanceof String text) {
            if (text.matches("\\d+")) {
                return Long.valueOf(text);
            }
            return related.parseResourceUri(text)
                    .orElseThrow(() -> new InvalidPayloadException(field.getName(),
                            "'" + text + "' is not a " + related.getResourceName() + " resource URI"));
        }
        throw new InvalidPayloadException(field.getName(),
                "Unsupported reference for field '" + field.getName() + "': " + value);
    }
}
