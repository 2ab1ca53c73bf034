package com.mediator.generator.codegen.model.core.context;

import java.util.concurrent.CancellationException;

/**
 * Lets the host abandon a run whose input snapshot has been invalidated.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NONE = () -> false;

    boolean isCancellationRequested();

    default void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Handler registration generation was cancelled");
        }
    }
}
