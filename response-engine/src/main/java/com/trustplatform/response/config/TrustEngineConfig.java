package com.trustplatform.response.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustplatform.common.analysis.StructuralAnalyzer;
import com.trustplatform.common.composition.CompositionEngine;
import com.trustplatform.common.exception.TrustEngineException;
import com.trustplatform.common.graph.TrustGraph;
import com.trustplatform.common.model.TrustEdge;
import com.trustplatform.common.policy.ResponsePolicySet;
import com.trustplatform.common.propagation.PropagationModelRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the Spring-free trust core from {@code common-lib} as singletons.
 *
 * <p>{@code trust.propagation.bayesian-probabilities} is a comma-separated list of
 * {@code from->to=probability} entries, e.g. {@code "gateway->auth=0.9,auth->db=0.8"}.
 */
@Configuration
public class TrustEngineConfig {

    @Value("${trust.propagation.bayesian-probabilities:}")
    private String bayesianProbabilities;

    @Bean
    public TrustGraph trustGraph() {
        return new TrustGraph();
    }

    @Bean
    public StructuralAnalyzer structuralAnalyzer() {
        return new StructuralAnalyzer();
    }

    @Bean
    public PropagationModelRegistry propagationModelRegistry() {
        return PropagationModelRegistry.withDefaults(parseProbabilities(bayesianProbabilities));
    }

    @Bean
    public CompositionEngine compositionEngine(TrustGraph graph,
                                               PropagationModelRegistry models,
                                               StructuralAnalyzer analyzer) {
        return new CompositionEngine(graph, models, analyzer);
    }

    @Bean
    public ResponsePolicySet responsePolicySet() {
        return new ResponsePolicySet();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    static Map<String, Double> parseProbabilities(String raw) {
        Map<String, Double> probabilities = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return probabilities;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.lastIndexOf('=');
            int arrow = trimmed.indexOf("->");
            if (eq < 0 || arrow < 0 || arrow > eq) {
                throw new TrustEngineException("Malformed bayesian probability entry '" + trimmed
                    + "', expected from->to=probability");
            }
            String from = trimmed.substring(0, arrow).trim();
            String to = trimmed.substring(arrow + 2, eq).trim();
            try {
                probabilities.put(TrustEdge.key(from, to), Double.parseDouble(trimmed.substring(eq + 1).trim()));
            } catch (NumberFormatException e) {
                throw new TrustEngineException("Malformed probability in entry '" + trimmed + "'", e);
            }
        }
        return probabilities;
    }
}
