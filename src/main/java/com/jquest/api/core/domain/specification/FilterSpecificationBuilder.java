package com.jquest.api.core.domain.specification;

import com.jquest.api.core.resource.FilterKind;
import com.jquest.api.core.resource.ModelResource;
import com.jquest.api.core.resource.ResourceField;
import com.jquest.api.core.resource.ResourceRegistry;
import com.jquest.api.exception.InvalidFilterException;
import jakarta.persistence.Entity;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds exact-match JPA Specifications from list query parameters.
 *
 * <p>Keys are published field names; {@code __} separates the segments of a path through
 * relations, e.g. {@code user__username}. A key is accepted when the whole key is declared
 * in the resource's filtering, or when its first segment is a related field declared
 * {@link FilterKind#EXACT_WITH_RELATIONS} and the rest of the key is accepted by the related
 * resource, by the same rule. Keys are checked eagerly so a bad filter fails before any
 * query runs.</p>
 */
public class FilterSpecificationBuilder {

    public static final String PATH_SEPARATOR = "__";

    private FilterSpecificationBuilder() {
    }

    /**
     * Builds a specification that matches every filter exactly.
     * @param filters published filter key to raw value
     * @param resource the resource being listed
     * @param registry used to check lookups against related resources
     * @param <T> the entity type
     * @return the combined specification
     * @throws InvalidFilterException when a key is not allowed
     */
    public static <T> Specification<T> build(Map<String, String> filters, ModelResource<T> resource,
                                             ResourceRegistry registry) {
        Map<String, List<String>> paths = new LinkedHashMap<>();
        filters.forEach((key, value) -> paths.put(key, resolvePath(key, resource, registry)));

        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            paths.forEach((key, attributes) -> {
                String value = filters.get(key);
                if (attributes.isEmpty()) {
                    predicates.add(cb.equal(root.get("id"), parseUriId(key, value, resource)));
                    return;
                }
                Path<?> path = navigate(root, attributes, key);
                predicates.add(cb.equal(path, convert(key, value, path.getJavaType())));
            });
            query.distinct(true);
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    /**
     * Maps a published filter key to entity attribute names.
     * An empty list means the key addresses the object's own resource URI.
     */
    static List<String> resolvePath(String key, ModelResource<?> resource, ResourceRegistry registry) {
        Map<String, FilterKind> filtering = resource.getFiltering();
        if (filtering.containsKey(key)) {
            if (ModelResource.RESOURCE_URI.equals(key)) {
                return List.of();
            }
            List<String> attributes = new ArrayList<>();
            for (String segment : key.split(PATH_SEPARATOR)) {
                attributes.add(toCamelCase(segment));
            }
            return attributes;
        }

        int separator = key.indexOf(PATH_SEPARATOR);
        if (separator < 0) {
            throw notAllowed(key, key);
        }
        String head = key.substring(0, separator);
        String rest = key.substring(separator + PATH_SEPARATOR.length());
        ResourceField field = relatedField(resource, head);
        if (filtering.get(head) != FilterKind.EXACT_WITH_RELATIONS || field == null) {
            throw notAllowed(key, head);
        }
        ModelResource<?> related = registry.findResource(field.getRelatedResource())
                .orElseThrow(() -> notAllowed(key, head));

        List<String> attributes = new ArrayList<>();
        attributes.add(field.getAttribute() != null ? field.getAttribute() : toCamelCase(head));
        try {
            List<String> nested = resolvePath(rest, related, registry);
            attributes.addAll(nested.isEmpty() ? List.of("id") : nested);
        } catch (InvalidFilterException e) {
            throw new InvalidFilterException(key, "The '" + key + "' lookup is not allowed: " + e.getMessage());
        }
        return attributes;
    }

    private static ResourceField relatedField(ModelResource<?> resource, String name) {
        ResourceField field = resource.getFields().get(name);
        if (field == null) {
            field = resource.getAdditionalDetailFields().get(name);
        }
        return field != null && field.isRelated() ? field : null;
    }

    private static InvalidFilterException notAllowed(String key, String field) {
        return new InvalidFilterException(key, "The '" + field + "' field does not allow filtering");
    }

    private static Path<?> navigate(Root<?> root, List<String> attributes, String key) {
        From<?, ?> from = root;
        Path<?> path = root;
        for (int i = 0; i < attributes.size(); i++) {
            String attribute = attributes.get(i);
            boolean last = i == attributes.size() - 1;
            if (isRelation(from, attribute, key)) {
                Join<?, ?> join = from.join(attribute, JoinType.INNER);
                from = join;
                path = last ? join.get("id") : join;
            } else if (last) {
                path = from.get(attribute);
            } else {
                throw new InvalidFilterException(key, "Lookup '" + key + "' goes through a non-relational field");
            }
        }
        return path;
    }

    private static boolean isRelation(From<?, ?> from, String attribute, String key) {
        Class<?> type;
        try {
            type = from.get(attribute).getJavaType();
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterException(key, "The '" + key + "' filter does not match any field");
        }
        return Collection.class.isAssignableFrom(type) || type.isAnnotationPresent(Entity.class);
    }

    private static Long parseUriId(String key, String value, ModelResource<?> resource) {
        return resource.parseResourceUri(value)
                .orElseThrow(() -> new InvalidFilterException(key,
                        "'" + value + "' is not a " + resource.getResourceName() + " resource URI"));
    }

    /**
     * Converts a raw query value to the Java type of the filtered attribute.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object convert(String key, String value, Class<?> type) {
        try {
            if (type == String.class) {
                return value;
            }
            if (type == Boolean.class || type == boolean.class) {
                if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                    throw new IllegalArgumentException("not a boolean");
                }
                return Boolean.valueOf(value);
            }
            if (type == Long.class || type == long.class) {
                return Long.valueOf(value);
            }
            if (type == Integer.class || type == int.class) {
                return Integer.valueOf(value);
            }
            if (type == Double.class || type == double.class) {
                return Double.valueOf(value);
            }
            if (type == LocalDateTime.class) {
                return LocalDateTime.parse(value);
            }
            if (type == LocalDate.class) {
                return LocalDate.parse(value);
            }
            if (type.isEnum()) {
                return Enum.valueOf((Class<Enum>) type, value);
            }
            return value;
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidFilterException(key, "Invalid value '" + value + "' for filter '" + key + "'");
        }
    }

    static String toCamelCase(String snakeCase) {
        StringBuilder result = new StringBuilder();
        boolean upper = false;
        for (char c : snakeCase.toCharArray()) {
            if (c == '_') {
                upper = true;
            } else {
                result.append(upper ? Character.toUpperCase(c) : c);
                upper = false;
            }
        }
        return result.toString();
    }
}
