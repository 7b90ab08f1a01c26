package com.vuong.resthandler.core.outcome;

import com.vuong.resthandler.dto.ErrorCode;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result of a domain operation tagged with its kind: a value, a business fault
 * or an internal fault. Endpoints hand it to
 * {@link RequestOutcomeHandler#handleOutcome(Outcome)} which switches on the tag.
 * @param <T> the type of the success value
 */
public abstract class Outcome<T> {

    public enum Kind {
        OK,
        BUSINESS_FAULT,
        INTERNAL_FAULT
    }

    private Outcome() {
    }

    public abstract Kind getKind();

    public static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    public static <T> Outcome<T> businessFault(FaultDetail detail) {
        Objects.requireNonNull(detail, "detail");
        if (detail.getFamily() != ErrorCode.Family.BUSINESS) {
            throw new IllegalArgumentException("Not a business fault: " + detail.getErrorCode());
        }
        return new Fault<>(Kind.BUSINESS_FAULT, detail);
    }

    public static <T> Outcome<T> internalFault(FaultDetail detail) {
        Objects.requireNonNull(detail, "detail");
        return new Fault<>(Kind.INTERNAL_FAULT, detail);
    }

    /**
     * Classifies a raised error into a business or internal fault by its declared error code.
     * @param error the raised error
     * @param <T> the success type
     * @return a fault outcome, never {@link Kind#OK}
     */
    public static <T> Outcome<T> failure(Throwable error) {
        Objects.requireNonNull(error, "error");
        FaultDetail detail = FaultDetail.from(error);
        return detail.getFamily() == ErrorCode.Family.BUSINESS
                ? new Fault<>(Kind.BUSINESS_FAULT, detail)
                : new Fault<>(Kind.INTERNAL_FAULT, detail);
    }

    /**
     * Runs the work and captures whatever it raises.
     * @param work the operation
     * @param <T> the success type
     * @return {@link Kind#OK} with the returned value, or the classified fault
     */
    public static <T> Outcome<T> of(Supplier<? extends T> work) {
        try {
            return ok(work.get());
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            return failure(e);
        }
    }

    public boolean isOk() {
        return getKind() == Kind.OK;
    }

    /**
     * @return the success value
     * @throws IllegalStateException if this is a fault
     */
    public abstract T getValue();

    /**
     * @return the fault detail
     * @throws IllegalStateException if this is a success
     */
    public abstract FaultDetail getFault();

    public abstract <R> Outcome<R> map(Function<? super T, ? extends R> mapper);

    public abstract <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper);

    public abstract <R> R fold(Function<? super T, ? extends R> onOk, Function<FaultDetail, ? extends R> onFault);

    private static final class Ok<T> extends Outcome<T> {
        private final T value;

        private Ok(T value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.OK;
        }

        @Override
        public T getValue() {
            return value;
        }

        @Override
        public FaultDetail getFault() {
            throw new IllegalStateException("Outcome is OK");
        }

        @Override
        public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
            return Outcome.of(() -> mapper.apply(value));
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
            Outcome<Outcome<R>> mapped = Outcome.of(() -> mapper.apply(value));
            return mapped.isOk() ? mapped.getValue() : new Fault<>(mapped.getKind(), mapped.getFault());
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<FaultDetail, ? extends R> onFault) {
            return onOk.apply(value);
        }

        @Override
        public String toString() {
            return "Outcome.Ok(" + value + ")";
        }
    }

    private static final class Fault<T> extends Outcome<T> {
        private final Kind kind;
        private final FaultDetail detail;

        private Fault(Kind kind, FaultDetail detail) {
            this.kind = kind;
            this.detail = detail;
        }

        @Override
        public Kind getKind() {
            return kind;
        }

        @Override
        public T getValue() {
            throw new IllegalStateException("Outcome is a fault: " + detail.getErrorCode());
        }

        @Override
        public FaultDetail getFault() {
            return detail;
        }

        @Override
        public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
            return new Fault<>(kind, detail);
        }

        @Override
        public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
            return new Fault<>(kind, detail);
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> onOk, Function<FaultDetail, ? extends R> onFault) {
            return onFault.apply(detail);
        }

        @Override
        public String toString() {
            return "Outcome." + kind + "(" + detail + ")";
        }
    }
}
