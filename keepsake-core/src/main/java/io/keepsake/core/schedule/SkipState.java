package io.keepsake.core.schedule;

/**
 * Number of due-eligible triggers that elapsed since the owning job last became due.
 * Only {@link PeriodPolicy#isDue} mutates it.
 */
public final class SkipState {
    private int skipCount;

    public synchronized int skipCount() {
        return skipCount;
    }

    synchronized void increment() {
        skipCount++;
    }

    synchronized void reset() {
        skipCount = 0;
    }

    @Override
    public synchronized String toString() {
        return "SkipState[skipCount=" + skipCount + "]";
    }
}
