package com.securehealth.model;

import java.util.Map;

/**
 * A decrypted entity that can be shaped for a caller by role projection.
 */
public interface ProjectableEntity {

    EntityType entityType();

    /**
     * Attribute name to value, in declared order. Includes every attribute a caller could ever
     * be shown; projection decides which survive.
     */
    Map<String, Object> attributes();
}
