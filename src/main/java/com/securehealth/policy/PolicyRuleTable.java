package com.securehealth.policy;

import com.securehealth.model.EntityType;
import com.securehealth.model.Role;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable {entity type -> role -> action -> effect} table. A missing entry means the role
 * has no opinion on the action; it never implies a grant.
 */
public final class PolicyRuleTable {
    private final Map<EntityType, Map<Role, Map<Action, RuleEffect>>> rules;

    private PolicyRuleTable(Map<EntityType, Map<Role, Map<Action, RuleEffect>>> rules) {
        this.rules = rules;
    }

    public Optional<RuleEffect> lookup(EntityType entityType, Role role, Action action) {
        return Optional.ofNullable(this.rules.getOrDefault(entityType, Map.of())
                .getOrDefault(role, Map.of())
                .get(action));
    }

    public int size() {
        return this.rules.values().stream()
                .flatMap(byRole -> byRole.values().stream())
                .mapToInt(Map::size)
                .sum();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<EntityType, Map<Role, Map<Action, RuleEffect>>> rules = new EnumMap<>(EntityType.class);

        private Builder() {
        }

        public Builder allow(EntityType entityType, Role role, Action... actions) {
            return put(entityType, role, RuleEffect.ALLOW, actions);
        }

        public Builder deny(EntityType entityType, Role role, Action... actions) {
            return put(entityType, role, RuleEffect.DENY, actions);
        }

        private Builder put(EntityType entityType, Role role, RuleEffect effect, Action... actions) {
            Map<Action, RuleEffect> byAction = this.rules
                    .computeIfAbsent(entityType, k -> new EnumMap<>(Role.class))
                    .computeIfAbsent(role, k -> new EnumMap<>(Action.class));
            for (Action action : actions) {
                RuleEffect previous = byAction.put(action, effect);
                if (previous != null && previous != effect) {
                    throw new IllegalStateException("Conflicting rules for " + entityType + "/" + role + "/" + action);
                }
            }
            return this;
        }

        public PolicyRuleTable build() {
            Map<EntityType, Map<Role, Map<Action, RuleEffect>>> copy = new EnumMap<>(EntityType.class);
            this.rules.forEach((entityType, byRole) -> {
                Map<Role, Map<Action, RuleEffect>> roleCopy = new EnumMap<>(Role.class);
                byRole.forEach((role, byAction) -> roleCopy.put(role, Collections.unmodifiableMap(new EnumMap<>(byAction))));
                copy.put(entityType, Collections.unmodifiableMap(roleCopy));
            });
            return new PolicyRuleTable(Collections.unmodifiableMap(copy));
        }
    }
}
