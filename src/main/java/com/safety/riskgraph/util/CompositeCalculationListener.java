package com.safety.riskgraph.util;

import com.safety.riskgraph.api.CalculationListener;
import com.safety.riskgraph.api.NodeType;

import java.util.Arrays;

/**
 * Fans {@link CalculationListener} callbacks out to several listeners, in
 * registration order.
 */
public class CompositeCalculationListener implements CalculationListener {
    private CalculationListener[] listeners = new CalculationListener[0];

    public void add(CalculationListener listener) {
        CalculationListener[] old = listeners;
        CalculationListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    @Override
    public void onPassStart(long pass, String operation) {
        for (CalculationListener l : listeners)
            l.onPassStart(pass, operation);
    }

    @Override
    public void onNodeEvaluated(long pass, int nodeId, NodeType type, double value) {
        for (CalculationListener l : listeners)
            l.onNodeEvaluated(pass, nodeId, type, value);
    }

    @Override
    public void onNodeWarning(long pass, int nodeId, String message) {
        for (CalculationListener l : listeners)
            l.onNodeWarning(pass, nodeId, message);
    }

    @Override
    public void onPassEnd(long pass, String operation, int nodesEvaluated) {
        for (CalculationListener l : listeners)
            l.onPassEnd(pass, operation, nodesEvaluated);
    }
}
