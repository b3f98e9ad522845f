/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import com.powsybl.networktopology.json.TopologyJsonSerializer;
import com.powsybl.networktopology.network.TopologyNetworkFactory;
import com.powsybl.networktopology.util.TopologyAssert;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class UndirectedNetworkGraphTest {

    @Test
    void testFromTree() {
        NetworkTree tree = new NetworkGraphBuilder(TopologyNetworkFactory.createTwoSystems()).buildTree();
        UndirectedNetworkGraph graph = UndirectedNetworkGraph.fromTree(tree);

        TopologyAssert.assertSymmetric(graph);
        assertEquals(List.of("S1", "B1", "L1", "B2", "G", "S2", "B3", "L2", "BX", "M"), List.copyOf(graph.getNodes()));
        assertEquals(List.of(List.of("S1", "B1"), List.of("B1", "L1"), List.of("L1", "B2"), List.of("B2", "G"),
                        List.of("B2", "L2"), List.of("S2", "B3"), List.of("B3", "L2"), List.of("BX", "M")),
                graph.getEdges());
        assertEquals(tree.getEdgeCount(), graph.getEdgeCount());
        assertEquals(Set.of("L1", "G", "L2"), graph.getNeighbors("B2"));

        ComponentReport report = new UndirectedGraphAnalyzer(graph, tree.getRoots()).analyze();
        assertEquals(2, report.components().size());
        assertEquals(Set.of("BX", "M"), report.unconnected());
        assertEquals(List.of(List.of("S1", "B1", "L1", "B2", "L2", "B3", "S2")),
                report.connectingPaths().get(new SystemPair("S1", "S2")));

        StringWriter writer = new StringWriter();
        TopologyJsonSerializer.writeUndirectedGraph(graph, writer);
        assertTrue(writer.toString().contains("\"edges\""));
    }

    @Test
    void testFromTreeIgnoresSelfLinksAndIsolatedElements() {
        Map<String, List<String>> children = new LinkedHashMap<>();
        children.put("A", List.of("A", "B"));
        children.put("B", List.of("A"));
        children.put("C", List.of());
        NetworkTree tree = new NetworkTree(List.of("A"), List.of("A", "B", "C"), children);

        UndirectedNetworkGraph graph = UndirectedNetworkGraph.fromTree(tree);
        assertEquals(Set.of("A", "B"), graph.getNodes());
        assertEquals(Set.of("B"), graph.getNeighbors("A"));
        assertEquals(1, graph.getEdgeCount());
        assertFalse(graph.containsNode("C"));
    }
}
