package com.safety.riskgraph.fn;

import com.safety.riskgraph.util.ErrorRateLimiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Base class for probability combinations. Handles empty and NaN inputs and
 * error rate limiting so that a gate never throws into a recalculation.
 * <p>
 * Formula: {@code p = f(P)}
 */
public abstract class AbstractFnN implements FnN {
    private final Logger log = LogManager.getLogger(this.getClass());
    private final ErrorRateLimiter limiter = new ErrorRateLimiter(log, 1000);

    @Override
    public final double apply(double[] inputs) {
        if (inputs == null || inputs.length == 0) {
            return emptyValue();
        }
        for (double v : inputs) {
            if (Double.isNaN(v)) {
                return emptyValue();
            }
        }
        try {
            return calculate(inputs);
        } catch (Throwable t) {
            limiter.log("Error evaluating " + this.getClass().getSimpleName(), t);
            return emptyValue();
        }
    }

    /** Value used when there is nothing meaningful to combine. */
    protected double emptyValue() {
        return 0.0;
    }

    /**
     * Subclasses implement the actual logic here.
     */
    protected abstract double calculate(double[] inputs);
}
