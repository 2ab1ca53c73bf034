package com.mediator.generator.catalog.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class ConstructorDescriptor {

    @NonNull
    Accessibility accessibility;

    boolean isStatic;

    public static ConstructorDescriptor of(Accessibility accessibility) {
        return new ConstructorDescriptor(accessibility, false);
    }

    /**
     * Whether a container can call this constructor.
     */
    public boolean isUsable() {
        return !isStatic && accessibility.isContainerAccessible();
    }
}
