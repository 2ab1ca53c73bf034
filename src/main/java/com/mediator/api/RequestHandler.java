package com.mediator.api;

import java.util.concurrent.CompletableFuture;

/**
 * Handles an input of type {@code I}, producing an output of type {@code O}.
 *
 * Implementations are discovered at build time and registered through the
 * generated {@code registerHandlers} entry point.
 *
 * @param <I> the input type
 * @param <O> the output type
 */
public interface RequestHandler<I, O> {

    /**
     * Handles the input asynchronously. Cancelling the returned future signals the
     * handler to abandon the work.
     */
    CompletableFuture<O> handle(I input);
}
