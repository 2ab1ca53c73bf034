package com.mediator.generator.catalog.model;

import lombok.Value;

/**
 * Where a declaration or base-list clause appears.
 *
 * Any part may be absent: processor catalogs only know the declaring element,
 * hand-built catalogs often know nothing at all ({@link #NONE}).
 */
@Value
public class SourceLocation {

    public static final SourceLocation NONE = new SourceLocation(null, 0, 0, null);

    /** Source file path, or null. */
    String path;

    /** 1-based line, or 0 when unknown. */
    int line;

    /** 1-based column, or 0 when unknown. */
    int column;

    /** Qualified name of the declaring type, or null. */
    String elementName;

    public static SourceLocation of(String path, int line, int column, String elementName) {
        return new SourceLocation(path, line, column, elementName);
    }

    public static SourceLocation ofElement(String elementName) {
        return new SourceLocation(null, 0, 0, elementName);
    }

    public boolean isKnown() {
        return path != null || elementName != null;
    }

    /**
     * Renders {@code path:line:column}, falling back to the element name.
     */
    public String describe() {
        if (path != null) {
            return line > 0 ? path + ":" + line + ":" + column : path;
        }
        return elementName != null ? elementName : "<unknown location>";
    }
}
