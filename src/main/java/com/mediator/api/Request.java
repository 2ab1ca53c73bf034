package com.mediator.api;

/**
 * Marker for a request object that produces a response of type {@code O}.
 *
 * @param <O> the response type
 */
public interface Request<O> {
}
