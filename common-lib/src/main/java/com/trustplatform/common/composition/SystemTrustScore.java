package com.trustplatform.common.composition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustplatform.common.analysis.CriticalPath;
import com.trustplatform.common.analysis.WeakLink;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link CompositionEngine#calculateSystemTrust(List)}. Computed on demand, never stored.
 *
 * <ul>
 *   <li>{@code overallTrust}:    mean of all {@code componentScores}; 0.0 when nothing was reached</li>
 *   <li>{@code componentScores}: per component, mean over every model × root result</li>
 *   <li>{@code criticalPaths}:   cycles found from the requested roots</li>
 *   <li>{@code weakLinks}:       components scoring below 0.3, weakest first</li>
 * </ul>
 */
public record SystemTrustScore(
    @JsonProperty("overallTrust") double overallTrust,
    @JsonProperty("componentScores") Map<String, Double> componentScores,
    @JsonProperty("criticalPaths") List<CriticalPath> criticalPaths,
    @JsonProperty("weakLinks") List<WeakLink> weakLinks,
    @JsonProperty("timestamp") Instant timestamp
) {}
