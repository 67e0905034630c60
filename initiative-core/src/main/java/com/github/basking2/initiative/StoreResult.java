package com.github.basking2.initiative;

import java.sql.SQLIntegrityConstraintViolationException;

/**
 * The outcome of a single storage call.
 *
 * The public accessors flatten this into {@code true}/{@code false} or a present/absent value, but the DAOs
 * keep the real cause so it can be logged and tested.
 *
 * @param <T> The type of the value produced by a successful call.
 */
public final class StoreResult<T> {

    public enum Status {
        OK,
        NOT_FOUND,
        CONSTRAINT_VIOLATION,
        STORAGE_FAULT
    }

    private final Status status;
    private final T value;
    private final Exception cause;

    private StoreResult(final Status status, final T value, final Exception cause) {
        this.status = status;
        this.value = value;
        this.cause = cause;
    }

    public static <T> StoreResult<T> ok(final T value) {
        return new StoreResult<>(Status.OK, value, null);
    }

    public static <T> StoreResult<T> ok() {
        return new StoreResult<>(Status.OK, null, null);
    }

    public static <T> StoreResult<T> notFound() {
        return new StoreResult<>(Status.NOT_FOUND, null, null);
    }

    public static <T> StoreResult<T> constraintViolation(final Exception cause) {
        return new StoreResult<>(Status.CONSTRAINT_VIOLATION, null, cause);
    }

    public static <T> StoreResult<T> storageFault(final Exception cause) {
        return new StoreResult<>(Status.STORAGE_FAULT, null, cause);
    }

    /**
     * Classify a failed storage call.
     *
     * A {@link SQLIntegrityConstraintViolationException} anywhere in the cause chain is a constraint violation.
     * Anything else is a storage fault.
     *
     * @param e The exception raised by the storage layer.
     * @param <T> The result type.
     * @return A failed result carrying {@code e}.
     */
    public static <T> StoreResult<T> failure(final Exception e) {
        for (Throwable t = e; t != null && t.getCause() != t; t = t.getCause()) {
            if (t instanceof SQLIntegrityConstraintViolationException) {
                return constraintViolation(e);
            }
        }
        return storageFault(e);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public T getValue() {
        return value;
    }

    /**
     * @param other Returned when this result is not {@link Status#OK} or holds no value.
     * @return The value or {@code other}.
     */
    public T orElse(final T other) {
        return isOk() && value != null ? value : other;
    }

    public Exception getCause() {
        return cause;
    }

    @Override
    public String toString() {
        return "StoreResult{" + status + (cause == null ? "" : ", " + cause) + "}";
    }
}
