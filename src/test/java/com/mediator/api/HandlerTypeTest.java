package com.mediator.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.lang.reflect.ParameterizedType;
import java.util.List;

import org.junit.jupiter.api.Test;

class HandlerTypeTest {

    @Test
    void testCapturesSimpleTypeArguments() {
        HandlerType<String, Integer> type = new HandlerType<String, Integer>() {};

        assertThat(type.getInputType()).isEqualTo(String.class);
        assertThat(type.getOutputType()).isEqualTo(Integer.class);
    }

    @Test
    void testCapturesParameterizedOutput() {
        HandlerType<String, List<String>> type = new HandlerType<String, List<String>>() {};

        assertThat(type.getOutputType()).isInstanceOf(ParameterizedType.class);
        assertThat(type.getOutputType().getTypeName()).isEqualTo("java.util.List<java.lang.String>");
    }

    @Test
    void testEqualityIgnoresAnonymousClassIdentity() {
        HandlerType<String, Integer> first = new HandlerType<String, Integer>() {};
        HandlerType<String, Integer> second = new HandlerType<String, Integer>() {};
        HandlerType<String, Long> other = new HandlerType<String, Long>() {};

        assertThat(first).isEqualTo(second).hasSameHashCodeAs(second).isNotEqualTo(other);
        assertThat(first.toString())
                .isEqualTo("com.mediator.api.RequestHandler<java.lang.String, java.lang.Integer>");
    }

    @Test
    @SuppressWarnings("rawtypes")
    void testRawSubclassIsRejected() {
        assertThatThrownBy(RawHandlerType::new).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testResolvesThroughGenericIntermediateSubclass() {
        HandlerType<Integer, String> type = new Keyed<Integer>() {};

        assertThat(type.getInputType()).isEqualTo(Integer.class);
        assertThat(type.getOutputType()).isEqualTo(String.class);
        assertThat(type).isEqualTo(new HandlerType<Integer, String>() {});
    }

    @Test
    void testResolvesThroughTwoIntermediateSubclasses() {
        HandlerType<Long, String> type = new LongKeyed() {};

        assertThat(type.getInputType()).isEqualTo(Long.class);
    }

    @Test
    void testUnresolvedMethodTypeVariableIsRejected() {
        assertThatThrownBy(() -> captureOf(Integer.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not concrete");
    }

    @Test
    void testNestedUnresolvedTypeVariableIsRejected() {
        assertThatThrownBy(() -> new Listed<Integer>() {})
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("java.util.List<A>");
    }

    @SuppressWarnings("unused")
    private static <T> HandlerType<T, String> captureOf(Class<T> input) {
        return new HandlerType<T, String>() {};
    }

    @SuppressWarnings("rawtypes")
    static class RawHandlerType extends HandlerType {
    }

    abstract static class Keyed<A> extends HandlerType<A, String> {
    }

    abstract static class LongKeyed extends Keyed<Long> {
    }

    abstract static class Listed<A> extends HandlerType<List<A>, String> {
    }
}
