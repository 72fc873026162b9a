package com.jquest.api.core.resource;

import com.jquest.api.exception.RelationshipResolutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Turns a domain object into the field map published for its resource.
 *
 * <p>Base fields are always rendered. Additional-detail fields are rendered only when the
 * request path is exactly the canonical URI of the object, so a list that happens to contain
 * a single object is still rendered in list form. Each field is extracted first and then
 * replaced by the resource's override for that field, if it declares one.</p>
 */
@Component
public class ResourceProjector {
    private static final Logger logger = LoggerFactory.getLogger(ResourceProjector.class);

    private final ResourceRegistry registry;

    public ResourceProjector(ResourceRegistry registry) {
        this.registry = registry;
    }

    /**
     * Projects an object for the given request.
     * @param obj the object to render
     * @param request the request being answered
     * @param resource the resource the object is published through
     * @return the field map, in declaration order
     * @throws RelationshipResolutionException when a related field cannot be rendered
     */
    public Map<String, Object> project(Object obj, RequestContext request, ModelResource<?> resource) {
        Bundle bundle = new Bundle(obj, request);

        for (ResourceField field : resource.getFields().values()) {
            dehydrateField(field, bundle, resource);
        }

        if (isDetailRequest(obj, request, resource)) {
            logger.debug("Detail request for {} on {}, adding {} detail fields",
                    resource.getResourceName(), request.getPath(), resource.getAdditionalDetailFields().size());
            for (ResourceField field : resource.getAdditionalDetailFields().values()) {
                ResourceField bound = field.isRelated()
                        ? field.bind(resource.getApiName(), resource.getResourceName())
                        : field;
                dehydrateField(bound, bundle, resource);
            }
        }

        return bundle.getData();
    }

    /**
     * A request is a detail request when its path equals the canonical URI of the object.
     */
    public boolean isDetailRequest(Object obj, RequestContext request, ModelResource<?> resource) {
        return resource.getResourceUri(obj).equals(request.getPath());
    }

    private void dehydrateField(ResourceField field, Bundle bundle, ModelResource<?> resource) {
        bundle.getData().put(field.getName(), dehydrateValue(field, bundle));
        resource.getOverride(field.getName())
                .ifPresent(override -> bundle.getData().put(field.getName(), override.dehydrate(bundle)));
    }

    private Object dehydrateValue(ResourceField field, Bundle bundle) {
        Object value = field.extract(bundle);
        return switch (field.getKind()) {
            case ATTRIBUTE -> value;
            case TO_ONE -> dehydrateRelated(field, value, bundle.getRequest());
            case TO_MANY -> dehydrateMany(field, value, bundle.getRequest());
        };
    }

    private Object dehydrateMany(ResourceField field, Object value, RequestContext request) {
        if (value == null) {
            if (!field.isNullable()) {
                throw new RelationshipResolutionException("The related collection '" + field.getName()
                        + "' is empty and does not allow a null value");
            }
            return Collections.emptyList();
        }
        if (!(value instanceof Iterable<?> related)) {
            throw new RelationshipResolutionException("The related collection '" + field.getName()
                    + "' did not produce an iterable value");
        }
        List<Object> result = new ArrayList<>();
        for (Object element : related) {
            result.add(dehydrateRelated(field, element, request));
        }
        return result;
    }

    private Object dehydrateRelated(ResourceField field, Object value, RequestContext request) {
        if (value == null) {
            if (!field.isNullable()) {
                throw new RelationshipResolutionException("The related field '" + field.getName()
                        + "' is empty and does not allow a null value");
            }
            return null;
        }
        if (!field.isBound()) {
            throw new RelationshipResolutionException("The related field '" + field.getName()
                    + "' is not bound to an API namespace");
        }
        ModelResource<?> related = registry.findResource(field.getRelatedResource())
                .orElseThrow(() -> new RelationshipResolutionException("The related field '" + field.getName()
                        + "' points to unknown resource '" + field.getRelatedResource() + "'"));
        if (field.isFull()) {
            return project(value, request, related);
        }
        return related.getResourceUri(value, field.getApiName());
    }
}
