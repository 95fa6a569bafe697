package fr.lapetina.aigateway.infrastructure.health;

import java.util.Arrays;

/**
 * Fixed-size ring of the most recent latency samples of one provider.
 */
public final class LatencyWindow {

    private final long[] samples;
    private int next;
    private int count;

    public LatencyWindow(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Window size must be positive: " + size);
        }
        this.samples = new long[size];
    }

    public synchronized void record(long latencyMs) {
        samples[next] = latencyMs;
        next = (next + 1) % samples.length;
        if (count < samples.length) {
            count++;
        }
    }

    /**
     * Nearest-rank percentile over the window.
     *
     * @param quantile value in (0, 1]
     * @return the percentile, or {@link Double#NaN} when no sample was recorded
     */
    public synchronized double percentile(double quantile) {
        if (count == 0) {
            return Double.NaN;
        }
        long[] sorted = Arrays.copyOf(samples, count);
        Arrays.sort(sorted);
        int rank = (int) Math.ceil(quantile * count);
        return sorted[Math.max(0, Math.min(count, rank) - 1)];
    }

    public synchronized int count() {
        return count;
    }
}
