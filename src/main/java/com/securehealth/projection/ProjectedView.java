package com.securehealth.projection;

import com.securehealth.model.EntityType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Role-shaped payload. Omitted fields are absent; masked fields hold their redacted form.
 */
public final class ProjectedView {
    private final EntityType entityType;
    private final Map<String, Object> fields;

    ProjectedView(EntityType entityType, Map<String, Object> fields) {
        this.entityType = entityType;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public EntityType getEntityType() {
        return this.entityType;
    }

    public Map<String, Object> getFields() {
        return this.fields;
    }

    public Object get(String field) {
        return this.fields.get(field);
    }

    public boolean has(String field) {
        return this.fields.containsKey(field);
    }

    public Set<String> fieldNames() {
        return this.fields.keySet();
    }

    @Override
    public String toString() {
        return "ProjectedView[" + this.entityType + ", fields=" + this.fields.keySet() + "]";
    }
}
