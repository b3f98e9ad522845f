/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.network.ElementType;
import com.powsybl.networktopology.network.NetworkElement;
import com.powsybl.networktopology.network.NetworkModel;
import com.powsybl.networktopology.network.TopologyNetworkFactory;
import com.powsybl.networktopology.network.TopologyRole;
import com.powsybl.networktopology.network.behavior.BusBehavior;
import com.powsybl.networktopology.network.behavior.ElementBehaviorRegistry;
import com.powsybl.networktopology.network.behavior.TerminalBehavior;
import com.powsybl.networktopology.util.TopologyAssert;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static com.powsybl.networktopology.network.TopologyNetworkFactory.element;
import static org.junit.jupiter.api.Assertions.*;

class NetworkGraphBuilderTest {

    @Test
    void testSingleSystemTree() {
        NetworkTree tree = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem()).buildTree();
        assertEquals(List.of("S"), tree.getRoots());
        assertEquals(List.of("S", "B", "L", "B2", "G"), tree.getNodes());
        assertEquals(List.of("B"), tree.getChildren("S"));
        assertEquals(List.of("L"), tree.getChildren("B"));
        assertEquals(List.of("B2"), tree.getChildren("L"));
        assertEquals(List.of("G"), tree.getChildren("B2"));
        assertEquals(List.of(), tree.getChildren("G"));
        assertEquals(4, tree.getEdgeCount());
    }

    @Test
    void testSingleSystemGraph() {
        UndirectedNetworkGraph graph = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem()).buildUndirectedGraph();
        assertEquals(Set.of("S", "B", "L", "B2", "G"), graph.getNodes());
        assertEquals(Set.of("S", "L"), graph.getNeighbors("B"));
        assertEquals(Set.of("B"), graph.getNeighbors("S"));
        assertEquals(Set.of("B", "B2"), graph.getNeighbors("L"));
        assertEquals(Set.of("L", "G"), graph.getNeighbors("B2"));
        assertEquals(Set.of("B2"), graph.getNeighbors("G"));
        assertEquals(4, graph.getEdgeCount());
        assertEquals(List.of(List.of("B", "S"), List.of("B", "L"), List.of("L", "B2"), List.of("B2", "G")), graph.getEdges());
        TopologyAssert.assertSymmetric(graph);
    }

    @Test
    void testBusFallback() {
        UndirectedNetworkGraph graph = new NetworkGraphBuilder(TopologyNetworkFactory.createBusless()).buildUndirectedGraph();
        assertEquals(Set.of("Q", "R"), graph.getNeighbors("P"));
        assertEquals(Set.of("P", "R"), graph.getNeighbors("Q"));
        assertEquals(Set.of("P", "Q"), graph.getNeighbors("R"));
        // I is alone at its node
        assertFalse(graph.containsNode("I"));
        assertTrue(graph.getNeighbors("I").isEmpty());
        assertEquals(4, graph.getEdgeCount());
        TopologyAssert.assertSymmetric(graph);
    }

    @Test
    void testTwoSystems() {
        NetworkGraphBuilder builder = new NetworkGraphBuilder(TopologyNetworkFactory.createTwoSystems());
        NetworkTree tree = builder.buildTree();
        assertEquals(List.of("S1", "S2"), tree.getRoots());
        assertEquals(List.of("G"), tree.getChildren("B2"));
        assertEquals(List.of("L2"), tree.getChildren("B3"));
        assertEquals(List.of("B2"), tree.getChildren("L2"));
        assertEquals(List.of("M"), tree.getChildren("BX"));

        UndirectedNetworkGraph graph = builder.buildUndirectedGraph();
        assertEquals(Set.of("L1", "G", "L2"), graph.getNeighbors("B2"));
        assertEquals(Set.of("M"), graph.getNeighbors("BX"));
        assertEquals(8, graph.getEdgeCount());
        TopologyAssert.assertSymmetric(graph);
    }

    @Test
    void testChildrenAreComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        ElementBehaviorRegistry registry = ElementBehaviorRegistry.createDefault().with(ElementType.LOAD, new TerminalBehavior() {
            @Override
            public List<String> getChildren(NetworkElement element, NetworkModel model) {
                calls.incrementAndGet();
                return super.getChildren(element, model);
            }
        });
        NetworkGraphBuilder builder = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem(registry));
        builder.buildTree();
        builder.buildTree();
        assertEquals(List.of(), builder.getChildren("G"));
        assertEquals(1, calls.get());
    }

    @Test
    void testFailingBehavior() {
        ElementBehaviorRegistry registry = ElementBehaviorRegistry.createDefault().with(ElementType.BUS, new BusBehavior() {
            @Override
            public List<String> getChildren(NetworkElement element, NetworkModel model) {
                throw new IllegalStateException("Broken bus " + element.getId());
            }
        });
        ReportNode reportNode = TopologyAssert.createTestReportNode();
        NetworkTree tree = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem(registry), reportNode).buildTree();
        assertEquals(List.of(), tree.getChildren("B"));
        assertEquals(List.of(), tree.getChildren("B2"));
        assertEquals(List.of("B2"), tree.getChildren("L"));
        String report = TopologyAssert.printReport(reportNode);
        assertTrue(report.contains("Children of element B could not be computed: Broken bus B"));
        assertTrue(report.contains("Ownership tree built: 1 root(s), 5 element(s), 2 parent-child link(s)"));
    }

    @Test
    void testRegisteredHubRole() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("S", element("system", 1));
        elements.put("H", element("reactor", 1));
        elements.put("G", element("load", 1));
        ElementBehaviorRegistry registry = ElementBehaviorRegistry.createDefault().with(ElementType.REACTOR, new BusBehavior());
        NetworkModel model = NetworkModel.parse(elements, Map.of("1", List.of("S", "H", "G")), registry);
        assertEquals(TopologyRole.HUB, model.getRole("H"));

        NetworkGraphBuilder builder = new NetworkGraphBuilder(model);
        NetworkTree tree = builder.buildTree();
        assertEquals(List.of("H"), tree.getChildren("S"));
        assertEquals(List.of("G"), tree.getChildren("H"));

        UndirectedNetworkGraph graph = builder.buildUndirectedGraph();
        assertEquals(Set.of("H"), graph.getNeighbors("S"));
        assertEquals(Set.of("H"), graph.getNeighbors("G"));
        assertEquals(2, graph.getEdgeCount());
    }

    @Test
    void testConcurrentTreeBuilds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ElementBehaviorRegistry registry = ElementBehaviorRegistry.createDefault().with(ElementType.LOAD, new TerminalBehavior() {
            @Override
            public List<String> getChildren(NetworkElement element, NetworkModel model) {
                calls.incrementAndGet();
                return super.getChildren(element, model);
            }
        });
        NetworkGraphBuilder builder = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem(registry));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<NetworkTree>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(executor.submit(builder::buildTree));
            }
            for (Future<NetworkTree> future : futures) {
                assertEquals(List.of("B"), future.get().getChildren("S"));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, calls.get());
    }

    @Test
    void testUnknownElement() {
        NetworkGraphBuilder builder = new NetworkGraphBuilder(TopologyNetworkFactory.createSingleSystem());
        assertTrue(builder.getChildren("unknown").isEmpty());
    }
}
