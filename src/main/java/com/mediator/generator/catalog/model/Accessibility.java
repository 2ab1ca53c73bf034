package com.mediator.generator.catalog.model;

/**
 * Declared accessibility of a type or constructor.
 *
 * {@link #INTERNAL} is visibility limited to the consuming build unit. Java sources
 * never declare it; catalogs assembled for other hosts may.
 */
public enum Accessibility {
    PUBLIC,
    INTERNAL,
    PROTECTED,
    PACKAGE_PRIVATE,
    PRIVATE;

    /**
     * Whether generated registration code can reference and instantiate a member
     * with this accessibility.
     */
    public boolean isContainerAccessible() {
        return this == PUBLIC || this == INTERNAL;
    }

    /**
     * Returns the more restrictive of the two accessibilities.
     */
    public Accessibility restrictTo(Accessibility enclosing) {
        return this.ordinal() >= enclosing.ordinal() ? this : enclosing;
    }
}
