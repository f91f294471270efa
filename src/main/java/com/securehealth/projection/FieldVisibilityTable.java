package com.securehealth.projection;

import com.securehealth.model.EntityType;
import com.securehealth.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per entity type: role -> field -> {@link Visibility}, explicit per-role forbids, and the
 * masker used for each field.
 *
 * <p>With several roles the most open grant wins; a forbid held by any of the roles then
 * removes the field regardless of other grants. A field no held role mentions is omitted.
 */
public final class FieldVisibilityTable {
    private final Map<EntityType, Map<Role, Map<String, Visibility>>> grants;
    private final Map<EntityType, Map<Role, Set<String>>> forbids;
    private final Map<EntityType, Map<String, Masker>> maskers;

    private FieldVisibilityTable(Map<EntityType, Map<Role, Map<String, Visibility>>> grants,
                                 Map<EntityType, Map<Role, Set<String>>> forbids,
                                 Map<EntityType, Map<String, Masker>> maskers) {
        this.grants = grants;
        this.forbids = forbids;
        this.maskers = maskers;
    }

    public Visibility resolve(EntityType entityType, Set<Role> roles, String field) {
        Visibility result = Visibility.OMITTED;
        Map<Role, Map<String, Visibility>> byRole = this.grants.getOrDefault(entityType, Map.of());
        Map<Role, Set<String>> forbidden = this.forbids.getOrDefault(entityType, Map.of());
        for (Role role : roles) {
            if (forbidden.getOrDefault(role, Set.of()).contains(field)) {
                return Visibility.OMITTED;
            }
            result = result.mostOpen(byRole.getOrDefault(role, Map.of()).get(field));
        }
        return result;
    }

    public Masker maskerFor(EntityType entityType, String field) {
        return this.maskers.getOrDefault(entityType, Map.of()).getOrDefault(field, Masker.OPAQUE_VALUE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<EntityType, Map<Role, Map<String, Visibility>>> grants = new EnumMap<>(EntityType.class);
        private final Map<EntityType, Map<Role, Set<String>>> forbids = new EnumMap<>(EntityType.class);
        private final Map<EntityType, Map<String, Masker>> maskers = new EnumMap<>(EntityType.class);

        private Builder() {
        }

        public Builder visible(EntityType entityType, Role role, String... fields) {
            return grant(entityType, role, Visibility.VISIBLE, fields);
        }

        public Builder masked(EntityType entityType, Role role, String... fields) {
            return grant(entityType, role, Visibility.MASKED, fields);
        }

        public Builder forbid(EntityType entityType, Role role, String... fields) {
            Set<String> set = this.forbids.computeIfAbsent(entityType, k -> new EnumMap<>(Role.class))
                    .computeIfAbsent(role, k -> new HashSet<>());
            Collections.addAll(set, fields);
            return this;
        }

        public Builder masker(EntityType entityType, String field, Masker masker) {
            this.maskers.computeIfAbsent(entityType, k -> new HashMap<>()).put(field, masker);
            return this;
        }

        private Builder grant(EntityType entityType, Role role, Visibility visibility, String... fields) {
            Map<String, Visibility> byField = this.grants.computeIfAbsent(entityType, k -> new EnumMap<>(Role.class))
                    .computeIfAbsent(role, k -> new HashMap<>());
            for (String field : fields) {
                byField.merge(field, visibility, Visibility::mostOpen);
            }
            return this;
        }

        public FieldVisibilityTable build() {
            Map<EntityType, Map<Role, Map<String, Visibility>>> grantCopy = new EnumMap<>(EntityType.class);
            this.grants.forEach((type, byRole) -> {
                Map<Role, Map<String, Visibility>> roles = new EnumMap<>(Role.class);
                byRole.forEach((role, byField) -> roles.put(role, Map.copyOf(byField)));
                grantCopy.put(type, Collections.unmodifiableMap(roles));
            });
            Map<EntityType, Map<Role, Set<String>>> forbidCopy = new EnumMap<>(EntityType.class);
            this.forbids.forEach((type, byRole) -> {
                Map<Role, Set<String>> roles = new EnumMap<>(Role.class);
                byRole.forEach((role, fields) -> roles.put(role, Set.copyOf(fields)));
                forbidCopy.put(type, Collections.unmodifiableMap(roles));
            });
            Map<EntityType, Map<String, Masker>> maskerCopy = new EnumMap<>(EntityType.class);
            this.maskers.forEach((type, byField) -> maskerCopy.put(type, Map.copyOf(byField)));
            return new FieldVisibilityTable(Collections.unmodifiableMap(grantCopy),
                    Collections.unmodifiableMap(forbidCopy), Collections.unmodifiableMap(maskerCopy));
        }
    }
}
