package com.securehealth.projection;

/**
 * How a field is shown to a role. Declared from least to most open.
 */
public enum Visibility {
    OMITTED,
    MASKED,
    VISIBLE;

    public Visibility mostOpen(Visibility other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
