package com.twlb.loadbalancer.trust;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of per-node routing weights.
 * <p>
 * Produced by {@link TrustWeightEngine} once per refresh and published as a whole; readers
 * never observe a partially updated table.
 * </p>
 */
@Getter
public final class RoutingTable {

    private final List<String> nodeIds;
    private final Map<String, TrustState> states;
    private final RoutingMode mode;
    private final Instant builtAt;

    private RoutingTable(List<TrustState> states, RoutingMode mode, Instant builtAt) {
        Map<String, TrustState> byNode = new LinkedHashMap<>();
        for (TrustState state : states) {
            byNode.put(state.getNodeId(), state);
        }
        this.states = Collections.unmodifiableMap(byNode);
        this.nodeIds = List.copyOf(byNode.keySet());
        this.mode = mode;
        this.builtAt = builtAt;
    }

    public static RoutingTable of(List<TrustState> states, RoutingMode mode, Instant builtAt) {
        return new RoutingTable(states, mode, builtAt);
    }

    /**
     * Table published before the first refresh: every node at full trust.
     */
    public static RoutingTable initial(List<String> nodeIds, double weight, RoutingMode mode, Instant at) {
        return new RoutingTable(
            nodeIds.stream().map(id -> TrustState.fullTrust(id, weight, at)).toList(),
            mode,
            at
        );
    }

    public static RoutingTable empty(Instant at) {
        return new RoutingTable(List.of(), RoutingMode.ROUND_ROBIN, at);
    }

    /**
     * @return weight of the node, 0.0 when the table does not know it
     */
    public double weightOf(String nodeId) {
        TrustState state = states.get(nodeId);
        return state == null ? 0.0 : state.getWeight();
    }

    /**
     * Sum of the positive weights.
     */
    public double totalWeight() {
        double total = 0.0;
        for (TrustState state : states.values()) {
            if (state.getWeight() > 0.0) {
                total += state.getWeight();
            }
        }
        return total;
    }

    /**
     * @param defaultWeight the full-trust weight
     * @return node id to weight for every node whose weight differs from {@code defaultWeight}
     */
    public Map<String, Double> nonDefaultWeights(double defaultWeight) {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (TrustState state : states.values()) {
            if (Double.compare(state.getWeight(), defaultWeight) != 0) {
                weights.put(state.getNodeId(), state.getWeight());
            }
        }
        return weights;
    }

    public boolean isEmpty() {
        return states.isEmpty();
    }

    public int size() {
        return states.size();
    }

    @Override
    public String toString() {
        return "RoutingTable{mode=" + mode + ", nodes=" + states.size() + ", builtAt=" + builtAt + "}";
    }
}
