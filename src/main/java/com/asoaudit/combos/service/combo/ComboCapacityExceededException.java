package com.asoaudit.combos.service.combo;

/**
 * Raised when the token universe would produce more candidate combos than the
 * configured ceiling. The generator never truncates; callers shorten the input or
 * raise {@code combo.max-combos}.
 */
public class ComboCapacityExceededException extends RuntimeException {
    private final long requested;
    private final long limit;

    public ComboCapacityExceededException(long requested, long limit) {
        super(String.format("Combo candidate set of %d exceeds limit %d", requested, limit));
        this.requested = requested;
        this.limit = limit;
    }

    public long getRequested() { return requested; }
    public long getLimit() { return limit; }
}
