package dev.trex.devtools.util;

/**
 * Accumulates wall time over any number of start/stop intervals.
 */
public class StopWatch {
    private long started;
    private long total;

    public long start() {
        if (started == 0) {
            started = System.currentTimeMillis();
        }
        return started;
    }

    public long stop() {
        if (started == 0) {
            return 0;
        }
        long stopped = System.currentTimeMillis();
        total += stopped - started;
        started = 0;
        return stopped;
    }

    public boolean isRunning() {
        return started > 0;
    }

    public long total() {
        if (total > 0) {
            return total;
        } else {
            return -1;
        }
    }
}
