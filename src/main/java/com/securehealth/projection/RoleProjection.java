package com.securehealth.projection;

import com.securehealth.model.ProjectableEntity;
import com.securehealth.model.Role;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shapes a decrypted entity for a role set. Output follows the entity's declared field order,
 * so the same entity and roles always give the same view.
 */
@Component
public class RoleProjection {
    private static final String FALLBACK_MASK = "[MASKED]";

    private final FieldVisibilityTable visibilityTable;

    public RoleProjection(FieldVisibilityTable visibilityTable) {
        this.visibilityTable = visibilityTable;
    }

    public ProjectedView project(ProjectableEntity entity, Set<Role> roles) {
        Map<String, Object> fields = new LinkedHashMap<>();
        entity.attributes().forEach((field, value) -> {
            Visibility visibility = this.visibilityTable.resolve(entity.entityType(), roles, field);
            if (visibility == Visibility.VISIBLE) {
                fields.put(field, detach(value));
            } else if (visibility == Visibility.MASKED) {
                fields.put(field, value == null ? null : mask(entity, field, value));
            }
        });
        return new ProjectedView(entity.entityType(), fields);
    }

    /**
     * Read-only copy of list and map values, so a view never aliases the entity's state.
     */
    private static Object detach(Object value) {
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(detach(item));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((key, item) -> copy.put(key, detach(item)));
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }

    private String mask(ProjectableEntity entity, String field, Object value) {
        String masked = this.visibilityTable.maskerFor(entity.entityType(), field).mask(value);
        if (masked.equals(String.valueOf(value))) {
            return Masker.OPAQUE.equals(masked) ? FALLBACK_MASK : Masker.OPAQUE;
        }
        return masked;
    }
}
