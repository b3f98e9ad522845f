/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.powsybl.networktopology.util.mt.ParallelTasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.stream.IntStream;

import static com.powsybl.networktopology.util.Markers.PERFORMANCE_MARKER;

/**
 * Analysis of a forest of possibly cyclic trees: node sets, depths, values shared between trees,
 * connections between roots and path queries.
 *
 * <p>Each tree is identified by a label {@code Tree_<index>_<rootValue>}. Per tree work is dispatched
 * one task per root on a worker pool created with the analyzer and released by {@link #close()}, or on
 * a borrowed executor. Node sets and depths are cached per tree label for the analyzer lifetime.</p>
 *
 * @param <V> node value type
 */
public class ForestAnalyzer<V> implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ForestAnalyzer.class);

    private final List<ForestNode<V>> roots;

    private final List<String> treeLabels;

    private final ExecutorService ownedExecutor;

    private final Executor executor;

    private final Map<String, Set<V>> nodeSetCache = new ConcurrentHashMap<>();

    private final Map<String, Integer> depthCache = new ConcurrentHashMap<>();

    private final AtomicReference<ForestState<V>> state = new AtomicReference<>();

    /**
     * @param roots root nodes of the trees to analyze
     * @param threadCount size of the worker pool, 1 to run everything in the calling thread
     */
    public ForestAnalyzer(List<ForestNode<V>> roots, int threadCount) {
        this(roots, createExecutor(threadCount), true);
    }

    /**
     * Analyzer running its tasks on an executor it does not own.
     */
    public ForestAnalyzer(List<ForestNode<V>> roots, Executor executor) {
        this(roots, Objects.requireNonNull(executor), false);
    }

    private ForestAnalyzer(List<ForestNode<V>> roots, Executor executor, boolean owned) {
        this.roots = List.copyOf(Objects.requireNonNull(roots));
        this.executor = executor;
        this.ownedExecutor = owned ? (ExecutorService) executor : null;
        List<String> labels = new ArrayList<>(this.roots.size());
        for (int i = 0; i < this.roots.size(); i++) {
            labels.add(createTreeLabel(i, this.roots.get(i).getValue()));
        }
        this.treeLabels = Collections.unmodifiableList(labels);
        if (this.roots.isEmpty()) {
            LOGGER.warn("Forest analyzer created without any root");
        }
    }

    private static ExecutorService createExecutor(int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Invalid thread count: " + threadCount);
        }
        if (threadCount == 1) {
            return null;
        }
        return Executors.newFixedThreadPool(threadCount, new ThreadFactoryBuilder()
                .setNameFormat("forest-analyzer-%d")
                .setDaemon(true)
                .build());
    }

    public static String createTreeLabel(int index, Object rootValue) {
        return "Tree_" + index + "_" + rootValue;
    }

    public List<ForestNode<V>> getRoots() {
        return roots;
    }

    public List<String> getTreeLabels() {
        return treeLabels;
    }

    private <R> List<R> mapRoots(Function<Integer, R> task) {
        List<Integer> indexes = IntStream.range(0, roots.size()).boxed().toList();
        return ParallelTasks.map(indexes, task, executor);
    }

    private Set<V> getNodeSet(int index) {
        return nodeSetCache.computeIfAbsent(treeLabels.get(index),
            label -> Collections.unmodifiableSet(ForestTraverser.collect(roots.get(index))));
    }

    private int getDepth(int index) {
        return depthCache.computeIfAbsent(treeLabels.get(index), label -> ForestTraverser.depth(roots.get(index)));
    }

    /**
     * Values reachable from the given root, in breadth first order.
     */
    public Set<V> getAllNodesInTree(ForestNode<V> root) {
        return ForestTraverser.collect(root);
    }

    public int getTreeDepth(ForestNode<V> root) {
        return ForestTraverser.depth(root);
    }

    /**
     * Map each value of the forest to the labels of the trees containing it. Shared values and root
     * connections are published together in the analyzer state.
     */
    public Map<V, List<String>> analyzeForest() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        List<Set<V>> nodeSets = mapRoots(this::getNodeSet);
        Map<V, List<String>> treesByValue = new LinkedHashMap<>();
        for (int i = 0; i < nodeSets.size(); i++) {
            for (V value : nodeSets.get(i)) {
                treesByValue.computeIfAbsent(value, v -> new ArrayList<>()).add(treeLabels.get(i));
            }
        }
        Map<V, List<String>> sharedNodes = new LinkedHashMap<>();
        treesByValue.forEach((value, labels) -> {
            if (labels.size() > 1) {
                sharedNodes.put(value, labels);
            }
        });
        List<RootConnection<V>> connections = computeConnections(nodeSets);
        state.set(new ForestState<>(sharedNodes, connections));

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Forest of {} trees analyzed in {} ms", roots.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("Forest analyzed: {} trees, {} values, {} shared values, {} root connections",
                roots.size(), treesByValue.size(), sharedNodes.size(), connections.size());
        return treesByValue;
    }

    private List<RootConnection<V>> computeConnections(List<Set<V>> nodeSets) {
        List<List<RootConnection<V>>> connectionsByTree = mapRoots(i -> {
            List<RootConnection<V>> treeConnections = new ArrayList<>();
            for (int j = i + 1; j < nodeSets.size(); j++) {
                Set<V> common = new LinkedHashSet<>(nodeSets.get(i));
                common.retainAll(nodeSets.get(j));
                if (!common.isEmpty()) {
                    treeConnections.add(new RootConnection<>(treeLabels.get(i), treeLabels.get(j),
                            roots.get(i).getValue(), roots.get(j).getValue(), common));
                }
            }
            return treeConnections;
        });
        List<RootConnection<V>> connections = new ArrayList<>();
        connectionsByTree.forEach(connections::addAll);
        return connections;
    }

    public ForestState<V> getState() {
        ForestState<V> current = state.get();
        if (current == null) {
            analyzeForest();
            current = state.get();
        }
        return current;
    }

    public Map<V, List<String>> getSharedNodes() {
        return getState().getSharedNodes();
    }

    /**
     * Non empty intersections of the node sets of every two trees, ordered by tree index.
     */
    public List<RootConnection<V>> findConnectionsBetweenRoots() {
        return getState().getConnections();
    }

    public List<List<V>> findPathsInTree(ForestNode<V> root, V target) {
        return ForestTraverser.findPaths(root, target);
    }

    /**
     * Simple paths from {@code start} to {@code end} in the tree of the given root, {@code start}
     * being any node of that tree.
     */
    public List<List<V>> findPathsBetweenNodesInTree(ForestNode<V> root, V start, V end) {
        Objects.requireNonNull(start);
        ForestNode<V> startNode = ForestTraverser.collectNodes(root).get(start);
        if (startNode == null) {
            return List.of();
        }
        return ForestTraverser.findPaths(startNode, end);
    }

    public Map<String, List<List<V>>> findAllPathsToNode(V target) {
        Objects.requireNonNull(target);
        return byTreeLabel(mapRoots(i -> findPathsInTree(roots.get(i), target)));
    }

    public Map<String, List<List<V>>> findAllPathsBetweenNodes(V start, V end) {
        Objects.requireNonNull(start);
        Objects.requireNonNull(end);
        return byTreeLabel(mapRoots(i -> findPathsBetweenNodesInTree(roots.get(i), start, end)));
    }

    private Map<String, List<List<V>>> byTreeLabel(List<List<List<V>>> pathsByTree) {
        Map<String, List<List<V>>> result = new LinkedHashMap<>();
        for (int i = 0; i < pathsByTree.size(); i++) {
            if (!pathsByTree.get(i).isEmpty()) {
                result.put(treeLabels.get(i), pathsByTree.get(i));
            }
        }
        return result;
    }

    /**
     * Shortest path to the target across all trees. On ties the first tree, then the first path, wins.
     */
    public Optional<ShortestPath<V>> findShortestPathToNode(V target) {
        ShortestPath<V> shortest = null;
        for (Map.Entry<String, List<List<V>>> e : findAllPathsToNode(target).entrySet()) {
            for (List<V> path : e.getValue()) {
                if (shortest == null || path.size() < shortest.length()) {
                    shortest = new ShortestPath<>(e.getKey(), path, path.size());
                }
            }
        }
        return Optional.ofNullable(shortest);
    }

    public ForestStatistics<V> getForestStatistics() {
        Map<V, List<String>> sharedNodes = getSharedNodes();
        List<TreeInfo<V>> treesInfo = mapRoots(i -> new TreeInfo<>(roots.get(i).getValue(), getNodeSet(i).size(), getDepth(i)));
        return new ForestStatistics<>(roots.size(), treesInfo, sharedNodes);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
