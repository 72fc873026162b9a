package com.jquest.api.core.resource;

import com.jquest.api.annotation.BlankAllowed;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Id;
import jakarta.persistence.ManyToMany;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OneToOne;
import jakarta.persistence.Transient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.PropertyAccessorFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative definition of a resource backed by a JPA entity.
 *
 * <p>Fields are built from the entity schema: every simple persistent attribute becomes a
 * field named in snake_case, minus the configured excludes. Subclasses then declare related
 * fields, detail-only fields, per-field overrides and filtering in their constructor.</p>
 *
 * @param <T> the entity type
 */
public abstract class ModelResource<T> {

    public static final String RESOURCE_URI = "resource_uri";

    private static final Logger logger = LoggerFactory.getLogger(ModelResource.class);

    private final String resourceName;
    private final Class<T> entityClass;
    private final Map<String, ResourceField> fields;
    private final Map<String, ResourceField> additionalDetailFields = new LinkedHashMap<>();
    private final Map<String, FieldOverride> overrides = new LinkedHashMap<>();
    private final Map<String, FilterKind> filtering = new LinkedHashMap<>();
    private boolean alwaysReturnData;
    private String apiPrefix;
    private String apiName;

    protected ModelResource(String resourceName, Class<T> entityClass, String... excludes) {
        this.resourceName = resourceName;
        this.entityClass = entityClass;
        this.fields = buildFields(entityClass, Set.of(excludes));
        applySchemaOptionality(this.fields);
        this.fields.put(RESOURCE_URI, ResourceField.builder()
                .name(RESOURCE_URI)
                .readonly(true)
                .extractor(bundle -> getResourceUri(bundle.getObject()))
                .build());
    }

    /**
     * Builds the default fields from the entity schema. Optionality markers are not read here.
     */
    private static Map<String, ResourceField> buildFields(Class<?> entityClass, Set<String> excludes) {
        Map<String, ResourceField> result = new LinkedHashMap<>();
        for (Field field : getAllFields(entityClass)) {
            if (!isPublishable(field)) {
                continue;
            }
            String name = toSnakeCase(field.getName());
            if (excludes.contains(name) || excludes.contains(field.getName())) {
                continue;
            }
            Column column = field.getAnnotation(Column.class);
            boolean nullable = !field.getType().isPrimitive() && (column == null || column.nullable());
            result.put(name, ResourceField.builder()
                    .name(name)
                    .attribute(field.getName())
                    .nullable(nullable)
                    .readonly(field.isAnnotationPresent(Id.class))
                    .type(typeOf(field.getType()))
                    .build());
        }
        return result;
    }

    /**
     * Copies the blank-allowed marker of entity fields onto the matching resource fields.
     * Runs once, after the default field construction.
     */
    private void applySchemaOptionality(Map<String, ResourceField> resourceFields) {
        for (Field field : getAllFields(entityClass)) {
            if (!field.isAnnotationPresent(BlankAllowed.class)) {
                continue;
            }
            String name = toSnakeCase(field.getName());
            ResourceField resourceField = resourceFields.get(name);
            if (resourceField != null) {
                resourceFields.put(name, resourceField.withBlank(true));
            }
        }
    }

    private static boolean isPublishable(Field field) {
        int modifiers = field.getModifiers();
        return !Modifier.isStatic(modifiers)
                && !Modifier.isTransient(modifiers)
                && !field.isAnnotationPresent(Transient.class)
                && !field.isAnnotationPresent(OneToMany.class)
                && !field.isAnnotationPresent(ManyToOne.class)
                && !field.isAnnotationPresent(ManyToMany.class)
                && !field.isAnnotationPresent(OneToOne.class)
                && !field.isAnnotationPresent(ElementCollection.class);
    }

    private static List<Field> getAllFields(Class<?> type) {
        List<Field> result = new ArrayList<>();
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }
        for (Class<?> c : hierarchy) {
            result.addAll(Arrays.asList(c.getDeclaredFields()));
        }
        return result;
    }

    private static String typeOf(Class<?> type) {
        if (type == Boolean.class || type == boolean.class) {
            return "boolean";
        }
        if (type == Long.class || type == long.class || type == Integer.class || type == int.class
                || type == Short.class || type == short.class) {
            return "integer";
        }
        if (type == Double.class || type == double.class || type == Float.class || type == float.class) {
            return "float";
        }
        if (type == BigDecimal.class) {
            return "decimal";
        }
        if (type == LocalDateTime.class || type == Instant.class) {
            return "datetime";
        }
        if (type == LocalDate.class) {
            return "date";
        }
        return "string";
    }

    public static String toSnakeCase(String camelCase) {
        return camelCase.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toLowerCase();
    }

    // Declaration helpers, called from subclass constructors

    protected void field(ResourceField field) {
        fields.put(field.getName(), field);
    }

    protected void additionalDetailField(ResourceField field) {
        additionalDetailFields.put(field.getName(), field);
    }

    protected void override(String fieldName, FieldOverride override) {
        overrides.put(fieldName, override);
    }

    protected void filter(String fieldName, FilterKind kind) {
        filtering.put(fieldName, kind);
    }

    protected void readonly(String fieldName) {
        ResourceField field = fields.get(fieldName);
        if (field == null) {
            throw new IllegalArgumentException("Unknown field '" + fieldName + "' on resource " + resourceName);
        }
        fields.put(fieldName, field.asReadonly());
    }

    protected void alwaysReturnData() {
        this.alwaysReturnData = true;
    }

    /**
     * Attaches this resource to its URL namespace and binds the related base fields to it.
     * Called once by the registry at startup.
     */
    void bind(String apiPrefix, String apiName) {
        this.apiPrefix = apiPrefix;
        this.apiName = apiName;
        fields.replaceAll((name, field) -> field.isRelated() ? field.bind(apiName, resourceName) : field);
        logger.debug("Bound resource {} to {}/{}", resourceName, apiPrefix, apiName);
    }

    // Hooks

    /**
     * Checks a write payload before anything is hydrated or persisted.
     * @param payload the request body
     * @return validation error messages, empty when the payload is acceptable
     */
    public List<String> validate(Map<String, Object> payload) {
        return Collections.emptyList();
    }

    /**
     * Called after the payload has been hydrated into the entity and before it is saved.
     */
    public void beforeSave(T entity, Map<String, Object> payload) {
    }

    /**
     * Called after a newly created entity has been saved, in the same transaction.
     */
    public void afterCreate(T entity, Map<String, Object> payload, ResourceHydrator hydrator) {
    }

    // URIs

    public String getListUri() {
        if (apiName == null) {
            throw new IllegalStateException("Resource " + resourceName + " is not bound to an API namespace");
        }
        return apiPrefix + "/" + apiName + "/" + resourceName;
    }

    public String getSchemaUri() {
        return getListUri() + "/schema";
    }

    public String getResourceUri(Object obj) {
        return getResourceUri(obj, apiName);
    }

    /**
     * Canonical single-object URI of {@code obj} under the given api name.
     */
    public String getResourceUri(Object obj, String namespace) {
        if (apiPrefix == null || namespace == null) {
            throw new IllegalStateException("Resource " + resourceName + " is not bound to an API namespace");
        }
        Object id = PropertyAccessorFactory.forBeanPropertyAccess(obj).getPropertyValue("id");
        return apiPrefix + "/" + namespace + "/" + resourceName + "/" + id;
    }

    /**
     * Extracts the object id from one of this resource's canonical URIs.
     * @param uri the URI, with or without a trailing slash
     * @return the id, or empty when the URI does not address this resource
     */
    public Optional<Long> parseResourceUri(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        String listUri = getListUri() + "/";
        String value = uri.endsWith("/") ? uri.substring(0, uri.length() - 1) : uri;
        if (!value.startsWith(listUri)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.valueOf(value.substring(listUri.length())));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Describes the published fields, the filtering and the allowed methods.
     */
    public Map<String, Object> getSchema() {
        Map<String, Object> fieldSchemas = new LinkedHashMap<>();
        fields.values().forEach(field -> fieldSchemas.put(field.getName(), describe(field)));
        additionalDetailFields.values().forEach(field -> fieldSchemas.put(field.getName(), describe(field)));

        Map<String, Object> filters = new LinkedHashMap<>();
        filtering.forEach((name, kind) -> filters.put(name, kind.name().toLowerCase()));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("fields", fieldSchemas);
        schema.put("filtering", filters);
        schema.put("allowed_list_http_methods", List.of("get", "post"));
        schema.put("allowed_detail_http_methods", List.of("get", "put", "delete"));
        schema.put("default_format", "application/json");
        return schema;
    }

    private Map<String, Object> describe(ResourceField field) {
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("type", field.getType());
        description.put("nullable", field.isNullable());
        description.put("blank", field.isBlank());
        description.put("readonly", field.isReadonly());
        if (field.isRelated()) {
            description.put("related_type", field.getKind() == FieldKind.TO_MANY ? "to_many" : "to_one");
            description.put("related_resource", field.getRelatedResource());
        }
        if (additionalDetailFields.containsKey(field.getName())) {
            description.put("detail_only", true);
        }
        return description;
    }

    public String getResourceName() {
        return resourceName;
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public String getApiName() {
        return apiName;
    }

    public Map<String, ResourceField> getFields() {
        return Collections.unmodifiableMap(fields);
    }

    public Map<String, ResourceField> getAdditionalDetailFields() {
        return Collections.unmodifiableMap(additionalDetailFields);
    }

    public Optional<FieldOverride> getOverride(String fieldName) {
        return Optional.ofNullable(overrides.get(fieldName));
    }

    public Map<String, FilterKind> getFiltering() {
        return Collections.unmodifiableMap(filtering);
    }

    public boolean isAlwaysReturnData() {
        return alwaysReturnData;
    }
}
