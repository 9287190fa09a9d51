package com.safety.riskgraph.model;

import com.safety.riskgraph.api.NodeType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Arena of analysis nodes -- the editable DAG behind one workspace.
 *
 * Every instance (primary or clone) is registered here by its unique id. The
 * tree owns all structural edits so that parent and child lists stay
 * symmetric and clones stay in sync with their primaries.
 *
 * Editing model:
 * 1. Structure: {@link #addChild}, {@link #attachChild} and
 * {@link #removeChild} always act on the primary of the parent; the change is
 * then mirrored onto every clone of that parent.
 * 2. Semantics: {@link #edit(FaultNode, Consumer)} applies a mutation to the
 * primary and synchronizes its clones.
 * 3. Deletion: removing an edge only discards the child once no parent
 * references it any more; orphaned descendants are discarded with it.
 *
 * Not thread-safe. The calling context owns the tree and mutates it in place.
 */
@Log4j2
public final class FaultTree {
    private final String name;
    private final IdAllocator ids;
    private final Map<Integer, FaultNode> nodesById = new LinkedHashMap<>();
    private final List<FaultNode> topEvents = new ArrayList<>();

    public FaultTree(String name, IdAllocator ids) {
        this.name = name;
        this.ids = ids;
    }

    public String name() {
        return name;
    }

    public IdAllocator ids() {
        return ids;
    }

    public List<FaultNode> topEvents() {
        return Collections.unmodifiableList(topEvents);
    }

    public Collection<FaultNode> nodes() {
        return Collections.unmodifiableCollection(nodesById.values());
    }

    /**
     * Looks up an instance by id.
     *
     * @throws IllegalArgumentException if the id is unknown.
     */
    public FaultNode node(int id) {
        FaultNode n = nodesById.get(id);
        if (n == null)
            throw new IllegalArgumentException("Unknown node: " + id);
        return n;
    }

    public boolean contains(int id) {
        return nodesById.containsKey(id);
    }

    // ── Creation ─────────────────────────────────────────────────

    public FaultNode createTopEvent(String userName) {
        FaultNode te = newPrimary(NodeType.TOP_EVENT, userName);
        topEvents.add(te);
        return te;
    }

    /** Creates a new primary node of the given type below {@code parent}. */
    public FaultNode addChild(FaultNode parent, NodeType type, String userName) {
        FaultNode child = newPrimary(type, userName);
        attachChild(parent, child);
        return child;
    }

    /**
     * Adds an edge from the primary of {@code parent} to {@code child} and
     * mirrors it onto every clone of the parent.
     *
     * @throws IllegalArgumentException on a self edge or a node foreign to this tree.
     */
    public void attachChild(FaultNode parent, FaultNode child) {
        requireMember(parent);
        requireMember(child);
        FaultNode p = parent.primary();
        if (p == child || p == child.primary())
            throw new IllegalArgumentException("Self-edge not allowed: " + p.getUniqueId());
        link(p, child);
        syncClones(p);
    }

    /**
     * Places a clone of {@code source}'s primary below {@code newParent}. The
     * clone gets a fresh id and shares the primary's children.
     */
    public FaultNode cloneNode(FaultNode source, FaultNode newParent) {
        requireMember(source);
        FaultNode primary = source.primary();
        FaultNode clone = new FaultNode(ids.next(), primary.getNodeType());
        clone.setPrimaryInstance(false);
        clone.setOriginal(primary);
        clone.setOriginalId(primary.getUniqueId());
        clone.setX(primary.getX());
        clone.setY(primary.getY());
        nodesById.put(clone.getUniqueId(), clone);
        syncClone(primary, clone);
        attachChild(newParent, clone);
        log.debug("Cloned {} as {}", primary, clone);
        return clone;
    }

    // ── Editing ──────────────────────────────────────────────────

    /** Applies a semantic mutation to the primary of {@code node}, then syncs its clones. */
    public void edit(FaultNode node, Consumer<FaultNode> mutation) {
        requireMember(node);
        FaultNode primary = node.primary();
        mutation.accept(primary);
        syncClones(primary);
    }

    /**
     * Removes the edge from the primary of {@code parent} to {@code child}
     * (and from the parent's clones). The child is discarded only when no
     * parent references remain and it is not a top event.
     *
     * @return true if an edge was removed.
     */
    public boolean removeChild(FaultNode parent, FaultNode child) {
        requireMember(parent);
        FaultNode p = parent.primary();
        if (!p.childList().contains(child))
            return false;
        unlink(p, child);
        syncClones(p);
        discardIfOrphaned(child);
        return true;
    }

    /** Removes a top event and everything that only it referenced. */
    public void removeTopEvent(FaultNode topEvent) {
        if (!topEvents.remove(topEvent))
            throw new IllegalArgumentException("Not a top event: " + topEvent);
        discardIfOrphaned(topEvent);
    }

    // ── Clone synchronization ────────────────────────────────────

    /** Copies the semantic fields and child list of {@code primary} to all of its clones. */
    public void syncClones(FaultNode primary) {
        for (FaultNode clone : clonesOf(primary))
            syncClone(primary, clone);
    }

    public void syncAllClones() {
        for (FaultNode n : new ArrayList<>(nodesById.values()))
            if (n.isPrimaryInstance())
                syncClones(n);
    }

    public List<FaultNode> clonesOf(FaultNode node) {
        FaultNode primary = node.primary();
        List<FaultNode> clones = new ArrayList<>();
        for (FaultNode n : nodesById.values())
            if (!n.isPrimaryInstance() && n.getOriginalId() == primary.getUniqueId())
                clones.add(n);
        return clones;
    }

    /** The primary followed by all of its clones. */
    public List<FaultNode> instancesOf(FaultNode node) {
        List<FaultNode> all = new ArrayList<>();
        all.add(node.primary());
        all.addAll(clonesOf(node));
        return all;
    }

    /**
     * Re-resolves every clone's {@code original} reference from its original
     * id, e.g. after the records were rebuilt by a loader. A clone whose
     * primary is missing becomes its own reference.
     */
    public void fixCloneReferences() {
        for (FaultNode n : nodesById.values()) {
            if (n.isPrimaryInstance()) {
                n.setOriginal(n);
                continue;
            }
            FaultNode primary = nodesById.get(n.getOriginalId());
            if (primary != null && primary.isPrimaryInstance()) {
                n.setOriginal(primary);
            } else {
                log.warn("No primary {} for clone {}; using self", n.getOriginalId(), n.getUniqueId());
                n.setOriginal(n);
            }
        }
    }

    // ── Queries ──────────────────────────────────────────────────

    /**
     * Highest severity among the ancestors of every instance (primary or
     * clone) of {@code node}. Clones also climb through their original's
     * parents. Returns 3 when no ancestor carries a severity.
     */
    public int highestAncestorSeverity(FaultNode node) {
        Set<Integer> visited = new HashSet<>();
        Deque<FaultNode> stack = new ArrayDeque<>(instancesOf(node));
        int max = 0;
        while (!stack.isEmpty()) {
            FaultNode n = stack.pop();
            if (!visited.add(n.getUniqueId()))
                continue;
            if (n.getSeverity() != null)
                max = Math.max(max, n.getSeverity());
            stack.addAll(n.parentList());
            if (!n.isPrimaryInstance() && n.getOriginal() != null && n.getOriginal() != n)
                stack.addAll(n.getOriginal().parentList());
        }
        return max > 0 ? max : 3;
    }

    // ── Internals ────────────────────────────────────────────────

    private FaultNode newPrimary(NodeType type, String userName) {
        FaultNode n = new FaultNode(ids.next(), type);
        n.setUserName(userName != null ? userName : "");
        nodesById.put(n.getUniqueId(), n);
        return n;
    }

    private void syncClone(FaultNode primary, FaultNode clone) {
        clone.copySemanticsFrom(primary);
        if (!clone.childList().equals(primary.childList())) {
            for (FaultNode c : new ArrayList<>(clone.childList()))
                unlink(clone, c);
            for (FaultNode c : primary.childList())
                link(clone, c);
        }
    }

    private static void link(FaultNode parent, FaultNode child) {
        if (parent.childList().contains(child))
            return;
        parent.childList().add(child);
        child.parentList().add(parent);
    }

    private static void unlink(FaultNode parent, FaultNode child) {
        parent.childList().remove(child);
        child.parentList().remove(parent);
    }

    private void discardIfOrphaned(FaultNode node) {
        if (!node.parentList().isEmpty() || topEvents.contains(node) || !nodesById.containsKey(node.getUniqueId()))
            return;
        if (node.isPrimaryInstance()) {
            List<FaultNode> clones = clonesOf(node);
            if (!clones.isEmpty()) {
                promote(clones.get(0), clones);
                return;
            }
        }
        nodesById.remove(node.getUniqueId());
        log.debug("Discarded orphaned {}", node);
        for (FaultNode c : new ArrayList<>(node.childList())) {
            unlink(node, c);
            discardIfOrphaned(c);
        }
    }

    /**
     * The primary lost its last parent while clones survive elsewhere: the
     * first clone becomes the primary and the old record is dropped.
     */
    private void promote(FaultNode heir, List<FaultNode> clones) {
        FaultNode old = heir.getOriginal();
        heir.setPrimaryInstance(true);
        heir.setOriginal(heir);
        heir.setOriginalId(heir.getUniqueId());
        for (FaultNode c : clones) {
            if (c != heir) {
                c.setOriginal(heir);
                c.setOriginalId(heir.getUniqueId());
            }
        }
        nodesById.remove(old.getUniqueId());
        for (FaultNode c : new ArrayList<>(old.childList()))
            unlink(old, c);
        log.debug("Promoted {} to primary after {} was orphaned", heir, old.getUniqueId());
    }

    private void requireMember(FaultNode node) {
        if (node == null)
            throw new IllegalArgumentException("Node must not be null");
        if (nodesById.get(node.getUniqueId()) != node)
            throw new IllegalArgumentException("Node does not belong to tree '" + name + "': " + node);
    }
}
