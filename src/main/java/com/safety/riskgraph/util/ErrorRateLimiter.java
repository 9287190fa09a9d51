package com.safety.riskgraph.util;

import org.apache.logging.log4j.Logger;

/**
 * Limits the rate of repeated log lines.
 *
 * Recalculation walks every node of a tree, so a single malformed attribute on a
 * shared subtree would otherwise produce one identical line per visit.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private long lastLogTime;
    private boolean logged;
    private int suppressed;

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
    }

    public void log(String message, Throwable t) {
        if (admit()) {
            logger.error(message + suffix(), t);
        }
    }

    public void warn(String message) {
        if (admit()) {
            logger.warn(message + suffix());
        }
    }

    /** Number of lines dropped since the last emitted one. */
    public int suppressed() {
        return suppressed;
    }

    private boolean admit() {
        long now = System.nanoTime();
        if (!logged || now - lastLogTime > minIntervalNanos) {
            logged = true;
            lastLogTime = now;
            return true;
        }
        suppressed++;
        return false;
    }

    private String suffix() {
        if (suppressed == 0) {
            return "";
        }
        String s = " (" + suppressed + " similar suppressed)";
        suppressed = 0;
        return s;
    }
}
