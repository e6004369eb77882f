package com.trustplatform.common.composition;

import com.trustplatform.common.analysis.CriticalPath;
import com.trustplatform.common.analysis.StructuralAnalyzer;
import com.trustplatform.common.analysis.WeakLink;
import com.trustplatform.common.graph.GraphSnapshot;
import com.trustplatform.common.graph.TrustGraph;
import com.trustplatform.common.model.SecurityPosture;
import com.trustplatform.common.model.TrustNode;
import com.trustplatform.common.propagation.PropagationModelRegistry;
import com.trustplatform.common.propagation.TrustPropagationModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Orchestrates propagation models and structural analysis against one {@link TrustGraph}.
 *
 * <h3>System trust</h3>
 * <ol>
 *   <li>Take one {@link GraphSnapshot}; every step below reads only that snapshot.</li>
 *   <li>Run every registered model from every root; collect all values per component.</li>
 *   <li>Component score = arithmetic mean of its collected values.</li>
 *   <li>Overall trust = mean of the component scores (0.0 when none).</li>
 *   <li>Critical paths from the roots, weak links from the component scores.</li>
 * </ol>
 *
 * <h3>Composition rules</h3>
 * Kept sorted by priority. {@link #evaluateCompositionRules()} evaluates every rule; a match never
 * short-circuits lower-priority rules, and the actions of all matching rules are returned.
 *
 * <p>No Spring dependencies; the service module wires it as a bean.
 */
public class CompositionEngine {

    private static final Comparator<CompositionRule> BY_PRIORITY =
        Comparator.comparingInt(CompositionRule::priority);

    private final TrustGraph graph;
    private final PropagationModelRegistry models;
    private final StructuralAnalyzer analyzer;
    private final List<CompositionRule> rules = new CopyOnWriteArrayList<>();

    public CompositionEngine(TrustGraph graph, PropagationModelRegistry models, StructuralAnalyzer analyzer) {
        this.graph    = graph;
        this.models   = models;
        this.analyzer = analyzer;
    }

    public TrustGraph graph() {
        return graph;
    }

    public PropagationModelRegistry models() {
        return models;
    }

    public void addComponent(TrustNode node) {
        graph.addNode(node);
    }

    public SystemTrustScore calculateSystemTrust(List<String> rootComponents) {
        GraphSnapshot snapshot = graph.snapshot();
        Map<String, TrustPropagationModel> registered = models.all();

        Map<String, List<Double>> collected = new LinkedHashMap<>();
        for (TrustPropagationModel model : registered.values()) {
            for (String root : rootComponents) {
                model.propagate(snapshot, root).forEach((componentId, score) ->
                    collected.computeIfAbsent(componentId, k -> new ArrayList<>()).add(score));
            }
        }

        Map<String, Double> componentScores = new LinkedHashMap<>();
        collected.forEach((componentId, scores) -> componentScores.put(componentId, mean(scores)));

        double overallTrust = mean(componentScores.values());

        List<CriticalPath> criticalPaths = analyzer.findCriticalPaths(snapshot, rootComponents);
        List<WeakLink> weakLinks = analyzer.findWeakLinks(snapshot, componentScores);

        return new SystemTrustScore(overallTrust, componentScores, criticalPaths, weakLinks, Instant.now());
    }

    public PropagationAnalysis getPropagationAnalysis(String source) {
        GraphSnapshot snapshot = graph.snapshot();
        Map<String, Map<String, Double>> results = new LinkedHashMap<>();
        models.all().forEach((name, model) -> results.put(name, model.propagate(snapshot, source)));
        return new PropagationAnalysis(source, results, Instant.now());
    }

    // ── composition rules ───────────────────────────────────────────────────

    public synchronized void addCompositionRule(CompositionRule rule) {
        List<CompositionRule> updated = new ArrayList<>(rules);
        updated.removeIf(r -> r.ruleId().equals(rule.ruleId()));
        updated.add(rule);
        updated.sort(BY_PRIORITY);
        rules.clear();
        rules.addAll(updated);
    }

    public List<CompositionRule> compositionRules() {
        return List.copyOf(rules);
    }

    /** Actions of every matching rule, in rule priority order. */
    public List<CompositionAction> evaluateCompositionRules() {
        GraphSnapshot snapshot = graph.snapshot();
        List<CompositionAction> triggered = new ArrayList<>();
        for (CompositionRule rule : rules) {
            if (matches(snapshot, rule)) {
                triggered.addAll(rule.actions());
            }
        }
        return triggered;
    }

    private boolean matches(GraphSnapshot snapshot, CompositionRule rule) {
        for (CompositionCondition condition : rule.conditions()) {
            for (TrustNode node : snapshot.nodes()) {
                if (condition.componentType() != null && condition.componentType() != node.componentType()) {
                    continue;
                }
                if (condition.trustThreshold() != null && node.trustScore() < condition.trustThreshold()) {
                    return true;
                }
                if (condition.securityCondition() != null && violates(node, condition.securityCondition())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean violates(TrustNode node, SecurityCondition condition) {
        SecurityPosture posture = node.securityPosture();
        return posture.vulnerabilityScore() > condition.vulnerabilityThreshold()
            || posture.complianceScore() < condition.complianceThreshold()
            || (condition.patchStatusRequired() && posture.patchStatus() < 1.0);
    }

    private static double mean(Iterable<Double> values) {
        double sum = 0.0;
        int count = 0;
        for (double v : values) {
            sum += v;
            count++;
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
