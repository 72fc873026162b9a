package com.jquest.api.core.resource;

import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * State of one object being dehydrated: the object, the request it is rendered for
 * and the field map built so far.
 */
public class Bundle {

    private final Object obj;
    @Getter
    private final RequestContext request;
    @Getter
    private final Map<String, Object> data = new LinkedHashMap<>();

    public Bundle(Object obj, RequestContext request) {
        this.obj = obj;
        this.request = request;
    }

    /**
     * Returns the bundled object cast to the caller's type.
     * @param <T> the expected object type
     * @return the object
     */
    @SuppressWarnings("unchecked")
    public <T> T getObject() {
        return (T) obj;
    }

    public Object get(String fieldName) {
        return data.get(fieldName);
    }
}
