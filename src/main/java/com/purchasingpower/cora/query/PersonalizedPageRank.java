package com.purchasingpower.cora.query;

import com.google.common.base.Preconditions;
import com.purchasingpower.cora.knowledge.ReferenceGraph;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Personalized PageRank over a chunk subgraph.
 *
 * <p>The walk restarts on the seed chunks in proportion to their weights. Rank held by a node
 * with no outgoing edge inside the subgraph goes back to the restart distribution. Iteration
 * stops when the L1 change between two rounds falls below the tolerance, or after the maximum
 * number of rounds.
 */
public final class PersonalizedPageRank {

    private final double damping;
    private final int maxIterations;
    private final double tolerance;

    public PersonalizedPageRank(double damping, int maxIterations, double tolerance) {
        Preconditions.checkArgument(damping >= 0 && damping < 1, "damping must be in [0,1): %s", damping);
        Preconditions.checkArgument(maxIterations > 0, "maxIterations must be positive");
        this.damping = damping;
        this.maxIterations = maxIterations;
        this.tolerance = tolerance;
    }

    /**
     * @param nodes   subgraph nodes; edges of the graph leaving this set are ignored
     * @param seeds   restart weights, non-negative; uniform over all nodes when they sum to 0
     * @return rank per node, summing to 1
     */
    public Map<String, Double> rank(Collection<String> nodes, ReferenceGraph graph, Map<String, Double> seeds) {
        Set<String> members = new LinkedHashSet<>(nodes);
        Map<String, Double> ranks = new LinkedHashMap<>();
        if (members.isEmpty()) {
            return ranks;
        }

        Map<String, Double> restart = restartVector(members, seeds);
        Map<String, Integer> outDegree = new LinkedHashMap<>();
        for (String node : members) {
            int degree = 0;
            for (String successor : graph.successors(node)) {
                if (members.contains(successor)) {
                    degree++;
                }
            }
            outDegree.put(node, degree);
        }

        ranks.putAll(restart);
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            double dangling = 0;
            for (String node : members) {
                if (outDegree.get(node) == 0) {
                    dangling += ranks.get(node);
                }
            }

            Map<String, Double> next = new LinkedHashMap<>();
            for (String node : members) {
                double inflow = 0;
                for (String predecessor : graph.predecessors(node)) {
                    if (members.contains(predecessor)) {
                        inflow += ranks.get(predecessor) / outDegree.get(predecessor);
                    }
                }
                double teleport = restart.get(node);
                next.put(node, (1 - damping) * teleport + damping * (inflow + dangling * teleport));
            }

            double delta = 0;
            for (String node : members) {
                delta += Math.abs(next.get(node) - ranks.get(node));
            }
            ranks = next;
            if (delta < tolerance) {
                break;
            }
        }
        return ranks;
    }

    private static Map<String, Double> restartVector(Set<String> members, Map<String, Double> seeds) {
        double total = 0;
        for (String node : members) {
            total += Math.max(0.0, seeds.getOrDefault(node, 0.0));
        }
        Map<String, Double> restart = new LinkedHashMap<>();
        for (String node : members) {
            double weight = total > 0
                    ? Math.max(0.0, seeds.getOrDefault(node, 0.0)) / total
                    : 1.0 / members.size();
            restart.put(node, weight);
        }
        return restart;
    }
}
