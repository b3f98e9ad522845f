/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.network.NetworkElement;
import com.powsybl.networktopology.network.NetworkModel;
import com.powsybl.networktopology.network.NodeConnection;
import com.powsybl.networktopology.network.TopologyRole;
import com.powsybl.networktopology.network.behavior.ElementBehavior;
import com.powsybl.networktopology.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import static com.powsybl.networktopology.util.Markers.PERFORMANCE_MARKER;

/**
 * Builds the ownership tree and the undirected connectivity graph of a network model.
 * Children are computed once per element for a builder instance, a builder may be shared between threads.
 */
public class NetworkGraphBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkGraphBuilder.class);

    private final NetworkModel model;

    private final ReportNode reportNode;

    private final Map<String, List<String>> childrenCache = new ConcurrentHashMap<>();

    public NetworkGraphBuilder(NetworkModel model) {
        this(model, ReportNode.NO_OP);
    }

    public NetworkGraphBuilder(NetworkModel model, ReportNode reportNode) {
        this.model = Objects.requireNonNull(model);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public NetworkModel getModel() {
        return model;
    }

    /**
     * Children of an element according to its behavior. An unknown element, an element without
     * behavior or an element whose behavior fails has no children.
     */
    public List<String> getChildren(String elementId) {
        Objects.requireNonNull(elementId);
        return childrenCache.computeIfAbsent(elementId, this::computeChildren);
    }

    private List<String> computeChildren(String elementId) {
        Optional<NetworkElement> element = model.getElement(elementId);
        if (element.isEmpty()) {
            LOGGER.warn("Element '{}' not found", elementId);
            return List.of();
        }
        Optional<ElementBehavior> behavior = model.getBehavior(element.get().getType());
        if (behavior.isEmpty()) {
            return List.of();
        }
        try {
            return List.copyOf(behavior.get().getChildren(element.get(), model));
        } catch (RuntimeException e) {
            LOGGER.warn("Cannot compute children of element '{}': {}", elementId, e.getMessage(), e);
            Reports.reportChildrenFailure(reportNode, elementId, String.valueOf(e.getMessage()));
            return List.of();
        }
    }

    public NetworkTree buildTree() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        Map<String, List<String>> children = new LinkedHashMap<>();
        for (String elementId : model.getElementIds()) {
            children.put(elementId, getChildren(elementId));
        }
        NetworkTree tree = new NetworkTree(model.getRootElementIds(), new ArrayList<>(model.getElementIds()), children);

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Ownership tree built in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("Ownership tree built: {} roots, {} elements, {} parent-child links",
                tree.getRoots().size(), tree.getNodes().size(), tree.getEdgeCount());
        Reports.reportTreeSize(reportNode, tree.getRoots().size(), tree.getNodes().size(), tree.getEdgeCount());
        return tree;
    }

    /**
     * Connect elements sharing a node. When a bus is present at a node, every bus is linked to every
     * other element of the node, otherwise elements are linked pairwise.
     */
    public UndirectedNetworkGraph buildUndirectedGraph() {
        Stopwatch stopwatch = Stopwatch.createStarted();

        Map<String, Set<String>> adjacency = new LinkedHashMap<>();
        for (NodeConnection connection : model.getNodeConnections()) {
            List<String> ids = connection.elementIds();
            List<String> busIds = ids.stream().filter(this::isBus).toList();
            if (busIds.isEmpty()) {
                for (int i = 0; i < ids.size(); i++) {
                    for (int j = i + 1; j < ids.size(); j++) {
                        UndirectedNetworkGraph.addEdge(adjacency, ids.get(i), ids.get(j));
                    }
                }
            } else {
                for (String busId : busIds) {
                    for (String id : ids) {
                        UndirectedNetworkGraph.addEdge(adjacency, busId, id);
                    }
                }
            }
        }
        UndirectedNetworkGraph graph = new UndirectedNetworkGraph(adjacency);

        stopwatch.stop();
        LOGGER.debug(PERFORMANCE_MARKER, "Undirected graph built in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        LOGGER.info("Undirected graph built: {} nodes, {} edges", graph.getNodes().size(), graph.getEdgeCount());
        Reports.reportUndirectedGraphSize(reportNode, graph.getNodes().size(), graph.getEdgeCount());
        return graph;
    }

    private boolean isBus(String elementId) {
        return model.getRole(elementId) == TopologyRole.HUB;
    }
}
