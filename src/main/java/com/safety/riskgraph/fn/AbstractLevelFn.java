package com.safety.riskgraph.fn;

import com.safety.riskgraph.util.ErrorRateLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for assurance level combinations. Inputs are clipped to [1,5]
 * before {@link #calculate(int[])} sees them and the result is clipped again,
 * so implementations can assume well-formed levels.
 */
public abstract class AbstractLevelFn implements LevelFn {
    private final Logger log = LogManager.getLogger(this.getClass());
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    @Override
    public final int apply(int[] levels) {
        if (levels == null || levels.length == 0) {
            return 1;
        }
        int[] clipped = new int[levels.length];
        for (int i = 0; i < levels.length; i++) {
            clipped[i] = clip(levels[i]);
        }
        try {
            return clip(calculate(clipped));
        } catch (Throwable t) {
            limiter.log("Error evaluating " + this.getClass().getSimpleName(), t);
            return 1;
        }
    }

    protected static int clip(int level) {
        return Math.max(1, Math.min(5, level));
    }

    protected abstract int calculate(int[] levels);
}
