package com.procflow.integration.contract.executor;

import com.procflow.integration.enumerations.ProcFlowErrorKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one executor invocation. The set of outcomes is closed:
 * {@link Continue}, {@link Suspend} and {@link Fail}, discriminated by {@link #getType()}.
 */
public interface ExecutorResult {

    enum Type {
        CONTINUE,
        SUSPEND,
        FAIL
    }

    Type getType();

    static Continue proceed(Map<String, Object> outputs) {
        return new Continue(outputs, null);
    }

    static Continue proceed(Map<String, Object> outputs, List<String> nextOverride) {
        return new Continue(outputs, nextOverride);
    }

    static Suspend suspend(Map<String, Object> reviewPayload) {
        return new Suspend(reviewPayload);
    }

    static Fail fail(ProcFlowErrorKind errorKind, boolean retryable, String message) {
        return new Fail(errorKind, retryable, message);
    }

    /**
     * Node finished. {@code nextOverride}, when present, replaces edge-based routing.
     */
    record Continue(Map<String, Object> outputs, List<String> nextOverride) implements ExecutorResult {

        public Continue {
            outputs = outputs == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
            nextOverride = nextOverride == null ? null : List.copyOf(nextOverride);
        }

        @Override
        public Type getType() {
            return Type.CONTINUE;
        }

        public boolean hasNextOverride() {
            return nextOverride != null;
        }
    }

    /**
     * Branch waits for a human decision carrying {@code reviewPayload}.
     */
    record Suspend(Map<String, Object> reviewPayload) implements ExecutorResult {

        public Suspend {
            reviewPayload = reviewPayload == null
                    ? Collections.emptyMap()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(reviewPayload));
        }

        @Override
        public Type getType() {
            return Type.SUSPEND;
        }
    }

    record Fail(ProcFlowErrorKind errorKind, boolean retryable, String message) implements ExecutorResult {

        @Override
        public Type getType() {
            return Type.FAIL;
        }

        /**
         * Same failure, no longer eligible for retry.
         */
        public Fail fatal() {
            return retryable ? new Fail(errorKind, false, message) : this;
        }
    }
}
