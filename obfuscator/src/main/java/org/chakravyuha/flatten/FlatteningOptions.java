package org.chakravyuha.flatten;

import org.chakravyuha.StatePool;

import java.util.Objects;

/**
 * Engine knobs. Everything else (which passes run, how often) is decided by the caller.
 */
public final class FlatteningOptions {

    private final TrivialBlockPolicy trivialBlockPolicy;
    private final StatePool.Factory statePoolFactory;
    private final boolean verify;

    private FlatteningOptions(Builder builder) {
        this.trivialBlockPolicy = builder.trivialBlockPolicy;
        this.statePoolFactory = builder.statePoolFactory;
        this.verify = builder.verify;
    }

    public static FlatteningOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TrivialBlockPolicy getTrivialBlockPolicy() {
        return trivialBlockPolicy;
    }

    public StatePool.Factory getStatePoolFactory() {
        return statePoolFactory;
    }

    public boolean isVerify() {
        return verify;
    }

    @Override
    public String toString() {
        return String.format("FlatteningOptions{trivialBlocks=%s, verify=%s}", trivialBlockPolicy, verify);
    }

    public static final class Builder {
        private TrivialBlockPolicy trivialBlockPolicy = TrivialBlockPolicy.INCLUDE;
        private StatePool.Factory statePoolFactory = StatePool.sequentialFactory();
        private boolean verify = true;

        private Builder() {
        }

        public Builder trivialBlockPolicy(TrivialBlockPolicy policy) {
            this.trivialBlockPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public Builder statePoolFactory(StatePool.Factory factory) {
            this.statePoolFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        public Builder verify(boolean verify) {
            this.verify = verify;
            return this;
        }

        public FlatteningOptions build() {
            return new FlatteningOptions(this);
        }
    }
}
