/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.Pseudograph;

import java.util.*;

/**
 * Symmetric adjacency between connected elements. Elements without any neighbor are not part of
 * the graph.
 */
public final class UndirectedNetworkGraph {

    private final Map<String, Set<String>> adjacency;

    UndirectedNetworkGraph(Map<String, Set<String>> adjacency) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((id, neighbors) -> {
            if (!neighbors.isEmpty()) {
                copy.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(neighbors)));
            }
        });
        this.adjacency = Collections.unmodifiableMap(copy);
    }

    /**
     * Undirected view of an ownership tree: every parent-child link becomes an edge. Self links are
     * ignored and elements without any link are not part of the graph.
     */
    public static UndirectedNetworkGraph fromTree(NetworkTree tree) {
        Objects.requireNonNull(tree);
        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> e : tree.getChildrenMap().entrySet()) {
            for (String childId : e.getValue()) {
                addEdge(adjacency, e.getKey(), childId);
            }
        }
        return new UndirectedNetworkGraph(adjacency);
    }

    static void addEdge(Map<String, Set<String>> adjacency, String id1, String id2) {
        if (id1.equals(id2)) {
            return;
        }
        adjacency.computeIfAbsent(id1, k -> new LinkedHashSet<>()).add(id2);
        adjacency.computeIfAbsent(id2, k -> new LinkedHashSet<>()).add(id1);
    }

    public Set<String> getNodes() {
        return adjacency.keySet();
    }

    public Set<String> getNeighbors(String id) {
        return adjacency.getOrDefault(id, Set.of());
    }

    public boolean containsNode(String id) {
        return adjacency.containsKey(id);
    }

    public Map<String, Set<String>> getAdjacency() {
        return adjacency;
    }

    /**
     * Each undirected edge once, as a two elements list, in node insertion order.
     */
    public List<List<String>> getEdges() {
        List<List<String>> edges = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (Map.Entry<String, Set<String>> e : adjacency.entrySet()) {
            for (String neighbor : e.getValue()) {
                if (!done.contains(neighbor)) {
                    edges.add(List.of(e.getKey(), neighbor));
                }
            }
            done.add(e.getKey());
        }
        return edges;
    }

    public int getEdgeCount() {
        int degreeSum = 0;
        for (Set<String> neighbors : adjacency.values()) {
            degreeSum += neighbors.size();
        }
        return degreeSum / 2;
    }

    public Graph<String, DefaultEdge> toJGraphT() {
        return toJGraphT(adjacency);
    }

    static Graph<String, DefaultEdge> toJGraphT(Map<String, ? extends Collection<String>> adjacency) {
        Graph<String, DefaultEdge> graph = new Pseudograph<>(DefaultEdge.class);
        adjacency.keySet().forEach(graph::addVertex);
        Set<String> done = new HashSet<>();
        for (Map.Entry<String, ? extends Collection<String>> e : adjacency.entrySet()) {
            for (String neighbor : e.getValue()) {
                if (!done.contains(neighbor) && !neighbor.equals(e.getKey())) {
                    graph.addVertex(neighbor);
                    graph.addEdge(e.getKey(), neighbor);
                }
            }
            done.add(e.getKey());
        }
        return graph;
    }

    @Override
    public String toString() {
        return "UndirectedNetworkGraph(nodes=" + adjacency.size() + ", edges=" + getEdgeCount() + ")";
    }
}
