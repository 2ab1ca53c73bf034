package com.mediator.generator.catalog.model;

import lombok.NonNull;
import lombok.Value;

/**
 * One entry of a type's {@code extends}/{@code implements} list.
 */
@Value
public class BaseTypeClause {

    @NonNull
    TypeReference type;

    @NonNull
    SourceLocation location;

    public static BaseTypeClause of(TypeReference type) {
        return new BaseTypeClause(type, SourceLocation.NONE);
    }

    public static BaseTypeClause of(TypeReference type, SourceLocation location) {
        return new BaseTypeClause(type, location);
    }
}
