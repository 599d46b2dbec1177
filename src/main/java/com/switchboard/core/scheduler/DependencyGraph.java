package com.switchboard.core.scheduler;

import com.switchboard.core.model.WorkerContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dependencies between the top-level tasks of a plan, derived from worker contracts.
 * <p>
 * Task {@code i} depends on task {@code j} ({@code i != j}) when any input of i's worker is
 * an output of j's worker. Inference is by declared artifact names only, so it may add
 * false dependencies but never misses a declared one.
 */
public final class DependencyGraph {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);

    private final List<Set<Integer>> dependsOn;

    private DependencyGraph(List<Set<Integer>> dependsOn) {
        this.dependsOn = dependsOn;
    }

    /**
     * @param contracts one contract per top-level task, in plan order; use
     *                  {@link WorkerContract#EMPTY} for tasks without a resolvable worker
     */
    public static DependencyGraph fromContracts(List<WorkerContract> contracts) {
        int n = contracts.size();
        var edges = new ArrayList<Set<Integer>>(n);
        for (int i = 0; i < n; i++) {
            var deps = new HashSet<Integer>();
            Set<String> inputs = contracts.get(i).inputs();
            if (!inputs.isEmpty()) {
                for (int j = 0; j < n; j++) {
                    if (i != j && !Collections.disjoint(inputs, contracts.get(j).outputs())) {
                        deps.add(j);
                    }
                }
            }
            if (!deps.isEmpty()) {
                log.debug("  task {} depends on {}", i, deps);
            }
            edges.add(Collections.unmodifiableSet(deps));
        }
        return new DependencyGraph(Collections.unmodifiableList(edges));
    }

    public int size() {
        return dependsOn.size();
    }

    public Set<Integer> dependsOn(int index) {
        return dependsOn.get(index);
    }

    /**
     * Indices from {@code remaining} whose dependencies have all completed, in ascending order.
     */
    public List<Integer> ready(Collection<Integer> remaining, Set<Integer> completed) {
        return remaining.stream()
                .filter(i -> completed.containsAll(dependsOn.get(i)))
                .sorted()
                .toList();
    }

    /** True when the graph contains at least one dependency edge. */
    public boolean hasEdges() {
        return dependsOn.stream().anyMatch(d -> !d.isEmpty());
    }
}
