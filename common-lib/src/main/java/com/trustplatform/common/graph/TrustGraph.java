package com.trustplatform.common.graph;

import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.model.TrustNode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Shared directed graph of components ({@link TrustNode}) and relationships ({@link TrustEdge}).
 *
 * <h3>Storage</h3>
 * <ul>
 *   <li>{@code nodes}:        id → node, upsert on registration</li>
 *   <li>{@code edges}:        {@code "from->to"} → edge, upsert (no multi-edges)</li>
 *   <li>{@code dependencies}: from → [to...] successor index, kept in step with {@code edges}</li>
 * </ul>
 *
 * <h3>Locking</h3>
 * A single {@link ReentrantReadWriteLock}: every mutation takes the write lock,
 * {@link #snapshot()} takes the read lock and copies. Propagation and structural analysis
 * only ever see a {@link GraphSnapshot}, so a traversal cannot observe a half-applied write.
 *
 * <p>Edges may reference ids that were never registered as nodes. They are kept and traversed;
 * callers treat results for such ids as "unknown trust".
 */
public class TrustGraph {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, TrustNode> nodes = new LinkedHashMap<>();
    private final Map<String, TrustEdge> edges = new LinkedHashMap<>();
    private final Map<String, List<String>> dependencies = new LinkedHashMap<>();

    /** Registers or replaces the node with the same id. */
    public void addNode(TrustNode node) {
        lock.writeLock().lock();
        try {
            nodes.put(node.id(), node);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Registers or replaces the edge keyed by {@code (from, to)}. A replacement keeps the
     * successor's original position in the dependency index.
     */
    public void addEdge(TrustEdge edge) {
        lock.writeLock().lock();
        try {
            TrustEdge previous = edges.put(edge.key(), edge);
            if (previous == null) {
                dependencies.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes the node and every edge that starts or ends at it.
     *
     * @return {@code true} if anything was removed
     */
    public boolean removeNode(String nodeId) {
        lock.writeLock().lock();
        try {
            boolean removed = nodes.remove(nodeId) != null;
            List<TrustEdge> touching = edges.values().stream()
                .filter(e -> e.from().equals(nodeId) || e.to().equals(nodeId))
                .toList();
            for (TrustEdge edge : touching) {
                unlinkEdge(edge);
            }
            return removed || !touching.isEmpty();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** @return {@code true} if the edge existed */
    public boolean removeEdge(String from, String to) {
        lock.writeLock().lock();
        try {
            TrustEdge edge = edges.get(TrustEdge.key(from, to));
            if (edge == null) {
                return false;
            }
            unlinkEdge(edge);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces the trust score of a registered node.
     *
     * @return {@code false} when no node with that id is registered
     */
    public boolean updateTrustScore(String nodeId, double trustScore, Instant updatedAt) {
        lock.writeLock().lock();
        try {
            TrustNode current = nodes.get(nodeId);
            if (current == null) {
                return false;
            }
            nodes.put(nodeId, current.withTrustScore(trustScore, updatedAt));
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Consistent, immutable copy of the whole graph. */
    public GraphSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new GraphSnapshot(nodes, edges, dependencies);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int nodeCount() {
        lock.readLock().lock();
        try {
            return nodes.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // ── internals (write lock held) ─────────────────────────────────────────

    private void unlinkEdge(TrustEdge edge) {
        edges.remove(edge.key());
        List<String> successors = dependencies.get(edge.from());
        if (successors != null) {
            successors.remove(edge.to());
            if (successors.isEmpty()) {
                dependencies.remove(edge.from());
            }
        }
    }
}
