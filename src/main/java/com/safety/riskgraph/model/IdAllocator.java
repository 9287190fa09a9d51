package com.safety.riskgraph.model;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Hands out unique node ids for one workspace.
 *
 * An allocator is injected into every {@link FaultTree} (and
 * {@link com.safety.riskgraph.dsl.FaultTreeBuilder}) that shares an id space,
 * instead of relying on a process-wide counter. Not thread-safe.
 */
public final class IdAllocator {
    private int next;

    public IdAllocator() {
        this(1);
    }

    public IdAllocator(int first) {
        this.next = first;
    }

    public int next() {
        return next++;
    }

    /** Id the next call to {@link #next()} will return. */
    public int peek() {
        return next;
    }

    /** Makes sure an id that already exists is never handed out again. */
    public void observe(int usedId) {
        if (usedId >= next) {
            next = usedId + 1;
        }
    }

    /**
     * Restarts the counter after the highest id found below the given roots,
     * e.g. after a workspace was loaded by an external collaborator.
     */
    public void resetFrom(Collection<FaultNode> roots) {
        int max = 0;
        Set<Integer> seen = new HashSet<>();
        Deque<FaultNode> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            FaultNode n = stack.pop();
            if (!seen.add(n.getUniqueId()))
                continue;
            max = Math.max(max, n.getUniqueId());
            for (FaultNode c : n.getChildren())
                stack.push(c);
        }
        next = max + 1;
    }
}
