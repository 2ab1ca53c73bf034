package com.mediator.generator.codegen.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.mediator.generator.codegen.model.HandlerRecord;

/**
 * Orders handler records by the ordinal (UTF-16 code unit, locale independent)
 * order of the handler's qualified name. The sort is stable, so the records of a
 * handler that implements the contract more than once keep their discovery order.
 */
public class HandlerSorter {

    public static final Comparator<HandlerRecord> BY_HANDLER_NAME =
            Comparator.comparing(HandlerRecord::getHandlerName);

    public List<HandlerRecord> sort(List<HandlerRecord> records) {
        List<HandlerRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_HANDLER_NAME);
        return List.copyOf(sorted);
    }
}
