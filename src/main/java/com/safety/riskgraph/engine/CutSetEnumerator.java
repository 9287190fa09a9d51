package com.safety.riskgraph.engine;

import com.safety.riskgraph.api.GateType;
import com.safety.riskgraph.model.FaultNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expands the AND/OR structure below a node into the combinations of leaf
 * ids that trigger it.
 *
 * - Leaf: {@code [{id}]}.
 * - AND: cartesian product of the children's lists, each pair unioned.
 * - OR (and any gate other than AND): concatenation of the children's lists.
 *
 * The result is a cover, not a set of minimal cut sets: no absorption or
 * deduplication is applied, and a subtree shared by several parents is
 * expanded once per path. A node that reappears on its own ancestor path
 * contributes no cut sets.
 */
public final class CutSetEnumerator {

    public List<Set<Integer>> cutSets(FaultNode node) {
        return expand(node, new HashSet<>());
    }

    private List<Set<Integer>> expand(FaultNode node, Set<Integer> path) {
        if (!path.add(node.getUniqueId()))
            return new ArrayList<>();
        try {
            if (node.isLeaf()) {
                List<Set<Integer>> single = new ArrayList<>();
                single.add(new TreeSet<>(Set.of(node.getUniqueId())));
                return single;
            }
            if (GateType.orDefault(node.getGateType()) == GateType.AND) {
                List<Set<Integer>> acc = new ArrayList<>();
                acc.add(new TreeSet<>());
                for (FaultNode child : node.getChildren()) {
                    List<Set<Integer>> childSets = expand(child, path);
                    List<Set<Integer>> next = new ArrayList<>(acc.size() * Math.max(1, childSets.size()));
                    for (Set<Integer> a : acc) {
                        for (Set<Integer> b : childSets) {
                            Set<Integer> union = new TreeSet<>(a);
                            union.addAll(b);
                            next.add(union);
                        }
                    }
                    acc = next;
                }
                return acc;
            }
            List<Set<Integer>> all = new ArrayList<>();
            for (FaultNode child : node.getChildren())
                all.addAll(expand(child, path));
            return all;
        } finally {
            path.remove(node.getUniqueId());
        }
    }
}
