package com.trustplatform.common.analysis;

import com.trustplatform.common.graph.GraphSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks over a {@link GraphSnapshot}: circular dependencies and weak links.
 *
 * <h3>Critical paths</h3>
 * Depth-first traversal from each root, tracking the nodes on the current path. An edge back to
 * a node still on the path closes a cycle; the slice of the path from that node to the top of
 * the stack is reported with criticality {@value #CYCLE_CRITICALITY}. Nodes are unmarked on
 * backtrack, so every simple path from the root is explored.
 *
 * <h3>Weak links</h3>
 * <pre>
 *   score &lt; 0.1 → immediate isolation, emergency security review
 *   score &lt; 0.3 → enhanced monitoring, security patch deployment   (weak-link boundary)
 *   score &lt; 0.5 → routine security review, performance review
 * </pre>
 * Only scores strictly below {@value #WEAK_LINK_THRESHOLD} are weak links; the 0.5 band is used
 * by {@link #mitigationSuggestions(double)} for callers that assess healthier components.
 *
 * <p>Stateless and thread-safe.
 */
public final class StructuralAnalyzer {

    public static final double WEAK_LINK_THRESHOLD = 0.3;
    public static final double CYCLE_CRITICALITY   = 1.0;

    /** Closure size above which an impact is flagged {@link ImpactSeverity#HIGH}. */
    static final int HIGH_IMPACT_COMPONENTS = 10;

    static final String CYCLE_DESCRIPTION = "Circular dependency detected";

    public List<CriticalPath> findCriticalPaths(GraphSnapshot graph, List<String> roots) {
        Set<List<String>> cycles = new LinkedHashSet<>();
        for (String root : roots) {
            dfs(graph, root, new HashSet<>(), new ArrayList<>(), cycles);
        }
        return cycles.stream()
            .map(path -> new CriticalPath(path, CYCLE_CRITICALITY, CYCLE_DESCRIPTION))
            .toList();
    }

    private void dfs(GraphSnapshot graph, String current, Set<String> onPath,
                     List<String> path, Set<List<String>> cycles) {
        if (onPath.contains(current)) {
            int start = path.indexOf(current);
            cycles.add(List.copyOf(path.subList(start, path.size())));
            return;
        }

        onPath.add(current);
        path.add(current);

        for (String next : graph.successors(current)) {
            dfs(graph, next, onPath, path, cycles);
        }

        path.remove(path.size() - 1);
        onPath.remove(current);
    }

    /**
     * @param scores final per-component scores, usually from the composition engine
     * @return weak links ordered weakest first
     */
    public List<WeakLink> findWeakLinks(GraphSnapshot graph, Map<String, Double> scores) {
        return scores.entrySet().stream()
            .filter(e -> e.getValue() < WEAK_LINK_THRESHOLD)
            .sorted(Map.Entry.<String, Double>comparingByValue()
                .thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .map(e -> new WeakLink(
                e.getKey(),
                e.getValue(),
                assessImpact(graph, e.getKey()),
                mitigationSuggestions(e.getValue())))
            .toList();
    }

    /** Breadth-first forward closure from {@code componentId}, the component itself included. */
    public ImpactAssessment assessImpact(GraphSnapshot graph, String componentId) {
        Set<String> affected = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(componentId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!affected.add(current)) {
                continue;
            }
            queue.addAll(graph.successors(current));
        }

        ImpactSeverity severity = affected.size() > HIGH_IMPACT_COMPONENTS
            ? ImpactSeverity.HIGH
            : ImpactSeverity.MODERATE;
        return new ImpactAssessment(new ArrayList<>(affected), severity);
    }

    public List<String> mitigationSuggestions(double score) {
        if (score < 0.1) {
            return List.of("Immediate isolation required", "Emergency security review");
        }
        if (score < WEAK_LINK_THRESHOLD) {
            return List.of("Enhanced monitoring required", "Security patch deployment");
        }
        if (score < 0.5) {
            return List.of("Routine security review", "Performance review");
        }
        return List.of();
    }
}
