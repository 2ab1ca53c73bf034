package com.mediator.api;

/**
 * Registration sink of a dependency-injection container. The generated
 * {@code registerHandlers} method calls {@link #registerScoped} once per discovered
 * handler.
 */
public interface HandlerRegistry {

    /**
     * Registers {@code implementationType} as the scoped implementation of
     * {@code RequestHandler<I, O>}: one instance per unit of work.
     *
     * @return this registry, for chaining
     */
    <I, O> HandlerRegistry registerScoped(HandlerType<I, O> handlerType,
                                          Class<? extends RequestHandler<I, O>> implementationType);
}
