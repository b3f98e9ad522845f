/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import com.google.common.base.Stopwatch;
import com.powsybl.networktopology.util.mt.ParallelTasks;
import org.jgrapht.Graph;
import org.jgrapht.GraphPath;
import org.jgrapht.alg.connectivity.ConnectivityInspector;
import org.jgrapht.alg.shortestpath.BFSShortestPath;
import org.jgrapht.graph.DefaultEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static com.powsybl.networktopology.util.Markers.PERFORMANCE_MARKER;

/**
 * Connectivity analysis of an undirected graph with respect to a set of system elements.
 *
 * <p>The graph and the system set are validated and the components computed at construction, an
 * analyzer is immutable afterwards and may be shared between threads. Shortest paths between system pairs
 * are computed one task per pair, on the given executor or inline when no executor is given.</p>
 */
public class UndirectedGraphAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(UndirectedGraphAnalyzer.class);

    private final Map<String, Set<String>> adjacency;

    private final Set<String> systemIds;

    private final Executor executor;

    private final Graph<String, DefaultEdge> graph;

    private final List<Set<String>> components;

    public UndirectedGraphAnalyzer(UndirectedNetworkGraph graph, Collection<String> systemIds) {
        this(graph.getAdjacency(), systemIds, null);
    }

    public UndirectedGraphAnalyzer(UndirectedNetworkGraph graph, Collection<String> systemIds, Executor executor) {
        this(graph.getAdjacency(), systemIds, executor);
    }

    public UndirectedGraphAnalyzer(Map<String, ? extends Collection<String>> adjacency, Collection<String> systemIds) {
        this(adjacency, systemIds, null);
    }

    /**
     * @param adjacency node id to neighbor ids, must be symmetric
     * @param systemIds designated system nodes, all of them must be part of the graph
     * @param executor executor running per pair tasks, null to run them in the calling thread
     * @throws GraphValidationException if the graph or the system set is not consistent
     */
    public UndirectedGraphAnalyzer(Map<String, ? extends Collection<String>> adjacency, Collection<String> systemIds, Executor executor) {
        Objects.requireNonNull(adjacency);
        Objects.requireNonNull(systemIds);
        validate(adjacency, systemIds);
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((id, neighbors) -> copy.put(id, Collections.unmodifiableSet(new LinkedHashSet<>(neighbors))));
        this.adjacency = Collections.unmodifiableMap(copy);
        this.systemIds = Collections.unmodifiableSet(new TreeSet<>(systemIds));
        this.executor = executor;
        this.graph = UndirectedNetworkGraph.toJGraphT(this.adjacency);
        this.components = computeComponents(graph);
    }

    private static List<Set<String>> computeComponents(Graph<String, DefaultEdge> graph) {
        List<Set<String>> connectedSets = new ArrayList<>();
        for (Set<String> connectedSet : new ConnectivityInspector<>(graph).connectedSets()) {
            connectedSets.add(Collections.unmodifiableSet(new LinkedHashSet<>(connectedSet)));
        }
        connectedSets.sort(Comparator.comparingInt((Set<String> c) -> c.size()).reversed());
        LOGGER.debug("{} connected components found", connectedSets.size());
        return Collections.unmodifiableList(connectedSets);
    }

    private static void validate(Map<String, ? extends Collection<String>> adjacency, Collection<String> systemIds) {
        if (adjacency.isEmpty()) {
            throw new GraphValidationException("Graph is empty");
        }
        if (systemIds.isEmpty()) {
            throw new GraphValidationException("System element set is empty");
        }
        for (Map.Entry<String, ? extends Collection<String>> e : adjacency.entrySet()) {
            String id = e.getKey();
            for (String neighbor : e.getValue()) {
                Collection<String> neighborNeighbors = adjacency.get(neighbor);
                if (neighborNeighbors == null) {
                    throw new GraphValidationException("Neighbor '" + neighbor + "' of node '" + id + "' is not part of the graph");
                }
                if (!neighborNeighbors.contains(id)) {
                    throw new GraphValidationException("Graph is not symmetric: '" + id + "' -> '" + neighbor
                            + "' has no reverse edge");
                }
            }
        }
        for (String systemId : systemIds) {
            if (!adjacency.containsKey(systemId)) {
                throw new GraphValidationException("System element '" + systemId + "' is not part of the graph");
            }
        }
    }

    public Set<String> getSystemIds() {
        return systemIds;
    }

    /**
     * Partition of the graph nodes into connected components, largest first.
     */
    public List<Set<String>> findAllComponents() {
        return components;
    }

    public ComponentClassification classifyComponents(List<Set<String>> componentsToClassify) {
        Objects.requireNonNull(componentsToClassify);
        List<Set<String>> systemComponents = new ArrayList<>();
        List<Set<String>> orphanComponents = new ArrayList<>();
        for (Set<String> component : componentsToClassify) {
            if (containsSystem(component)) {
                systemComponents.add(component);
            } else {
                orphanComponents.add(component);
            }
        }
        return new ComponentClassification(systemComponents, orphanComponents);
    }

    private boolean containsSystem(Set<String> component) {
        for (String systemId : systemIds) {
            if (component.contains(systemId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * All shortest paths between every pair of systems lying in a same component.
     */
    public Map<SystemPair, List<List<String>>> findConnectingElements() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<SystemPair> pairs = new ArrayList<>();
        for (Set<String> component : classifyComponents(findAllComponents()).systemComponents()) {
            List<String> componentSystemIds = systemIds.stream().filter(component::contains).toList();
            for (int i = 0; i < componentSystemIds.size(); i++) {
                for (int j = i + 1; j < componentSystemIds.size(); j++) {
                    pairs.add(new SystemPair(componentSystemIds.get(i), componentSystemIds.get(j)));
                }
            }
        }
        List<List<List<String>>> paths = ParallelTasks.map(pairs, pair -> findAllShortestPaths(pair.system1(), pair.system2()), executor);
        Map<SystemPair, List<List<String>>> connectingElements = new LinkedHashMap<>();
        for (int i = 0; i < pairs.size(); i++) {
            connectingElements.put(pairs.get(i), paths.get(i));
        }

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Shortest paths between {} system pairs computed in {} ms",
                pairs.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return connectingElements;
    }

    /**
     * Every shortest path between two nodes, found by a level by level breadth first search keeping
     * all predecessors of a node on the previous level.
     */
    public List<List<String>> findAllShortestPaths(String start, String end) {
        if (!adjacency.containsKey(start) || !adjacency.containsKey(end)) {
            return List.of();
        }
        if (start.equals(end)) {
            return List.of(List.of(start));
        }
        Map<String, Integer> levels = new HashMap<>();
        Map<String, List<String>> predecessors = new HashMap<>();
        levels.put(start, 0);
        List<String> currentLevel = List.of(start);
        int level = 0;
        while (!currentLevel.isEmpty() && !levels.containsKey(end)) {
            List<String> nextLevel = new ArrayList<>();
            for (String id : currentLevel) {
                for (String neighbor : adjacency.get(id)) {
                    Integer neighborLevel = levels.get(neighbor);
                    if (neighborLevel == null) {
                        levels.put(neighbor, level + 1);
                        nextLevel.add(neighbor);
                        predecessors.computeIfAbsent(neighbor, k -> new ArrayList<>()).add(id);
                    } else if (neighborLevel == level + 1) {
                        predecessors.get(neighbor).add(id);
                    }
                }
            }
            currentLevel = nextLevel;
            level++;
        }
        if (!levels.containsKey(end)) {
            return List.of();
        }
        List<List<String>> paths = new ArrayList<>();
        collectPaths(end, start, predecessors, new ArrayDeque<>(), paths);
        return paths;
    }

    private static void collectPaths(String id, String start, Map<String, List<String>> predecessors,
                                     Deque<String> suffix, List<List<String>> paths) {
        suffix.addFirst(id);
        if (id.equals(start)) {
            paths.add(new ArrayList<>(suffix));
        } else {
            for (String predecessor : predecessors.getOrDefault(id, List.of())) {
                collectPaths(predecessor, start, predecessors, suffix, paths);
            }
        }
        suffix.removeFirst();
    }

    /**
     * Nodes of the graph which are in no component containing a system.
     */
    public Set<String> findUnconnectedElements() {
        Set<String> unconnected = new LinkedHashSet<>();
        for (Set<String> component : classifyComponents(findAllComponents()).orphanComponents()) {
            unconnected.addAll(component);
        }
        return unconnected;
    }

    /**
     * All simple paths between two nodes, empty if one of them is not part of the graph.
     */
    public List<List<String>> findAllPaths(String start, String end) {
        if (!adjacency.containsKey(start) || !adjacency.containsKey(end)) {
            return List.of();
        }
        List<List<String>> paths = new ArrayList<>();
        walkSimplePaths(start, end, new ArrayList<>(), new HashSet<>(), paths);
        return paths;
    }

    private void walkSimplePaths(String id, String end, List<String> path, Set<String> onPath, List<List<String>> paths) {
        path.add(id);
        onPath.add(id);
        if (id.equals(end)) {
            paths.add(new ArrayList<>(path));
        } else {
            for (String neighbor : adjacency.get(id)) {
                if (!onPath.contains(neighbor)) {
                    walkSimplePaths(neighbor, end, path, onPath, paths);
                }
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(id);
    }

    public Optional<List<String>> findShortestPath(String start, String end) {
        if (!adjacency.containsKey(start) || !adjacency.containsKey(end)) {
            return Optional.empty();
        }
        GraphPath<String, DefaultEdge> path = BFSShortestPath.findPathBetween(graph, start, end);
        return path != null ? Optional.of(path.getVertexList()) : Optional.empty();
    }

    public GraphStatistics getGraphStatistics() {
        Map<String, Integer> degrees = new LinkedHashMap<>();
        int degreeSum = 0;
        for (Map.Entry<String, Set<String>> e : adjacency.entrySet()) {
            degrees.put(e.getKey(), e.getValue().size());
            degreeSum += e.getValue().size();
        }
        return new GraphStatistics(adjacency.size(), degreeSum / 2, Collections.unmodifiableMap(degrees), findAllComponents());
    }

    public ComponentReport analyze() {
        List<Set<String>> allComponents = findAllComponents();
        ComponentClassification classification = classifyComponents(allComponents);
        Map<SystemPair, List<List<String>>> connectingPaths = findConnectingElements();
        Set<String> unconnected = findUnconnectedElements();
        LOGGER.info("{} connected components ({} with system, {} orphan), {} unconnected elements",
                allComponents.size(), classification.systemComponents().size(), classification.orphanComponents().size(),
                unconnected.size());
        return new ComponentReport(allComponents, classification, connectingPaths, unconnected);
    }
}
