package nl.nfi.djwordlist.generate.stream;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Remaining output budget shared by all workers of a run, doubling as its cancellation token.
 * <p>
 * Workers call {@link #tryAcquire()} once per candidate, before writing it. Acquisition fails as soon as
 * the budget is spent or the run was cancelled, which is the signal to stop pulling from the shard.
 */
public final class Budget {

    private final boolean limited;
    private final AtomicLong remaining;
    private volatile boolean cancelled;

    private Budget(final boolean limited, final long remaining) {
        this.limited = limited;
        this.remaining = new AtomicLong(remaining);
    }

    public static Budget unlimited() {
        return new Budget(false, Long.MAX_VALUE);
    }

    public static Budget of(final long maxCount) {
        if (maxCount == Long.MAX_VALUE) {
            return unlimited();
        }
        if (maxCount < 0) {
            throw new IllegalArgumentException("Budget must not be negative: %d".formatted(maxCount));
        }
        return new Budget(true, maxCount);
    }

    public boolean tryAcquire() {
        if (cancelled) {
            return false;
        }
        if (!limited) {
            return true;
        }
        return remaining.getAndUpdate(count -> count > 0 ? count - 1 : 0) > 0;
    }

    public boolean isExhausted() {
        return cancelled || (limited && remaining.get() == 0);
    }

    public void cancel() {
        cancelled = true;
    }

    boolean isCancelled() {
        return cancelled;
    }

    boolean isLimited() {
        return limited;
    }

    long remaining() {
        return remaining.get();
    }

    /**
     * Splits a total into fixed per-worker quotas: {@code total / parts} each, the remainder spread over the
     * first workers. An unlimited total gives every worker an unlimited quota.
     */
    public static long[] quotas(final long total, final int parts) {
        final long[] quotas = new long[parts];
        for (int i = 0; i < parts; i++) {
            if (total == Long.MAX_VALUE) {
                quotas[i] = Long.MAX_VALUE;
            } else {
                quotas[i] = total / parts + (i < total % parts ? 1 : 0);
            }
        }
        return quotas;
    }
}
