package com.jquest.api.core.resource;

import lombok.Builder;
import lombok.Getter;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;

/**
 * Immutable descriptor of one published field of a resource.
 * Related fields carry the namespace (api name, owning resource) they were bound to;
 * binding produces a copy so a descriptor can be shared between requests.
 */
@Getter
@Builder(toBuilder = true)
public class ResourceField {

    private final String name;
    /** Bean property path on the object; ignored when {@link #extractor} is set. */
    private final String attribute;
    @Builder.Default
    private final FieldKind kind = FieldKind.ATTRIBUTE;
    /** Name of the related resource for {@link FieldKind#TO_ONE} and {@link FieldKind#TO_MANY}. */
    private final String relatedResource;
    /** Render related objects in full instead of as URIs. */
    private final boolean full;
    @Builder.Default
    private final boolean nullable = true;
    private final boolean blank;
    private final boolean readonly;
    @Builder.Default
    private final String type = "string";
    private final FieldExtractor extractor;
    private final String apiName;
    private final String ownerResource;

    public static ResourceField attribute(String name, String attribute) {
        return ResourceField.builder().name(name).attribute(attribute).build();
    }

    public static ResourceField toOne(String name, String attribute, String relatedResource, boolean full) {
        return ResourceField.builder()
                .name(name)
                .attribute(attribute)
                .kind(FieldKind.TO_ONE)
                .relatedResource(relatedResource)
                .full(full)
                .nullable(false)
                .type("related")
                .build();
    }

    public static ResourceField toMany(String name, String relatedResource, FieldExtractor extractor, boolean full) {
        return ResourceField.builder()
                .name(name)
                .kind(FieldKind.TO_MANY)
                .relatedResource(relatedResource)
                .extractor(extractor)
                .full(full)
                .readonly(true)
                .type("related")
                .build();
    }

    public boolean isRelated() {
        return kind != FieldKind.ATTRIBUTE;
    }

    public boolean isBound() {
        return apiName != null && ownerResource != null;
    }

    public ResourceField bind(String apiName, String ownerResource) {
        return toBuilder().apiName(apiName).ownerResource(ownerResource).build();
    }

    public ResourceField withBlank(boolean blank) {
        return toBuilder().blank(blank).build();
    }

    public ResourceField withNullable(boolean nullable) {
        return toBuilder().nullable(nullable).build();
    }

    public ResourceField asReadonly() {
        return toBuilder().readonly(true).build();
    }

    /**
     * Reads the raw value of this field from the bundled object.
     * @param bundle the bundle being dehydrated
     * @return the raw value, possibly null
     */
    public Object extract(Bundle bundle) {
        if (extractor != null) {
            return extractor.extract(bundle);
        }
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(bundle.getObject());
        return wrapper.getPropertyValue(attribute);
    }
}
