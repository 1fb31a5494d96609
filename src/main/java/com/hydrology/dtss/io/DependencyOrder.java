package com.hydrology.dtss.io;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hydrology.dtss.api.CycleException;

/**
 * Orders named nodes so that every node comes after the nodes it reads from.
 *
 * <p>
 * Kahn's algorithm over a name-indexed edge list. Nodes left over once no
 * node with in-degree 0 remains sit on (or behind) a cycle, and the whole
 * build is rejected.
 */
public final class DependencyOrder {
    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> nameToIdx = new HashMap<>();
    private final List<List<Integer>> forwardEdges = new ArrayList<>();

    public DependencyOrder addNode(String name) {
        if (nameToIdx.containsKey(name))
            throw new IllegalArgumentException("Duplicate node name: " + name);
        nameToIdx.put(name, names.size());
        names.add(name);
        forwardEdges.add(new ArrayList<>());
        return this;
    }

    /** Records that {@code to} reads from {@code from}. */
    public DependencyOrder addEdge(String from, String to) {
        forwardEdges.get(requireIndex(from)).add(requireIndex(to));
        return this;
    }

    private int requireIndex(String name) {
        Integer idx = nameToIdx.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    /**
     * @return node names, dependencies first
     * @throws CycleException if the edges contain a cycle
     */
    public List<String> sort() {
        int n = names.size();
        int[] inDegree = new int[n];
        for (List<Integer> targets : forwardEdges)
            for (int t : targets)
                inDegree[t]++;

        int[] queue = new int[n];
        int head = 0, tail = 0;
        for (int i = 0; i < n; i++)
            if (inDegree[i] == 0)
                queue[tail++] = i;

        List<String> order = new ArrayList<>(n);
        while (head < tail) {
            int curr = queue[head++];
            order.add(names.get(curr));
            for (int child : forwardEdges.get(curr))
                if (--inDegree[child] == 0)
                    queue[tail++] = child;
        }
        if (order.size() != n) {
            List<String> stuck = new ArrayList<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] > 0)
                    stuck.add(names.get(i));
            throw new CycleException("Cycle detected! Ordered " + order.size() + " of " + n
                    + " nodes, unresolved: " + stuck);
        }
        return order;
    }
}
