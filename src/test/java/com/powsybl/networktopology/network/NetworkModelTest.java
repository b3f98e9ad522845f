/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.network.behavior.ElementBehaviorRegistry;
import com.powsybl.networktopology.util.TopologyAssert;
import org.junit.jupiter.api.Test;

import java.util.*;

import static com.powsybl.networktopology.network.TopologyNetworkFactory.element;
import static org.junit.jupiter.api.Assertions.*;

class NetworkModelTest {

    @Test
    void testParse() {
        NetworkModel model = TopologyNetworkFactory.createSingleSystem();
        assertEquals(5, model.getElements().size());
        assertEquals(2, model.getNodeConnections().size());
        NetworkElement line = model.getElement("L").orElseThrow();
        assertEquals(ElementType.OVERHEAD_LINE, line.getType());
        assertEquals(List.of(1, 2), line.getNodes());
        assertEquals(1, line.getStartNode().getAsInt());
        assertEquals(2, line.getEndNode().getAsInt());
        assertEquals("Element_L", line.getName());
        assertEquals(List.of("1", "2"), model.getNodeIdsOf("L"));
        assertEquals(List.of("S", "B", "L"), model.getElementIdsAtNode("1"));
        assertEquals(List.of("S"), model.getRootElementIds());
    }

    @Test
    void testAttributes() {
        Map<String, Object> elements = new LinkedHashMap<>();
        Map<String, Object> generator = element("generator", 1);
        generator.put(NetworkModel.NAME_ATTRIBUTE, "Main generator");
        generator.put("Power", 100.0);
        elements.put("0123456789abcdef", generator);
        elements.put("S", element("system", 1));
        NetworkModel model = NetworkModel.parse(elements, Map.of("1", List.of("S", "0123456789abcdef")));

        NetworkElement element = model.getElement("0123456789abcdef").orElseThrow();
        assertEquals("Main generator", element.getName());
        assertEquals(100.0, element.getAttribute("Power"));
        assertEquals("generator", element.getAttribute(NetworkModel.TYPE_ATTRIBUTE));
        assertEquals("Element_S", model.getElement("S").orElseThrow().getName());
        assertThrows(UnsupportedOperationException.class, () -> element.getAttributes().put("x", 1));
    }

    @Test
    void testDefaultName() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("0123456789abcdef", element("load", 1));
        NetworkModel model = NetworkModel.parse(elements, Map.of());
        assertEquals("Element_01234567", model.getElement("0123456789abcdef").orElseThrow().getName());
    }

    @Test
    void testNodes() {
        Map<String, Object> elements = new LinkedHashMap<>();
        Map<String, Object> single = new HashMap<>();
        single.put(NetworkModel.TYPE_ATTRIBUTE, "load");
        single.put(NetworkModel.NODES_ATTRIBUTE, 4);
        elements.put("single", single);
        Map<String, Object> mixed = new HashMap<>();
        mixed.put(NetworkModel.TYPE_ATTRIBUTE, "overhead_line");
        mixed.put(NetworkModel.NODES_ATTRIBUTE, List.of(1, "x", 2.5, 3));
        elements.put("mixed", mixed);
        Map<String, Object> invalid = new HashMap<>();
        invalid.put(NetworkModel.TYPE_ATTRIBUTE, "load");
        invalid.put(NetworkModel.NODES_ATTRIBUTE, "1,2");
        elements.put("invalid", invalid);
        Map<String, Object> none = new HashMap<>();
        none.put(NetworkModel.TYPE_ATTRIBUTE, "load");
        elements.put("none", none);

        NetworkModel model = NetworkModel.parse(elements, null);
        assertEquals(List.of(4), model.getElement("single").orElseThrow().getNodes());
        assertEquals(4, model.getElement("single").orElseThrow().getEndNode().getAsInt());
        assertEquals(List.of(1, 3), model.getElement("mixed").orElseThrow().getNodes());
        assertTrue(model.getElement("invalid").orElseThrow().getNodes().isEmpty());
        assertTrue(model.getElement("none").orElseThrow().getStartNode().isEmpty());
        assertTrue(model.getElement("none").orElseThrow().getEndNode().isEmpty());
    }

    @Test
    void testMalformedElements() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("notAMap", List.of(1, 2));
        Map<String, Object> noType = new HashMap<>();
        noType.put(NetworkModel.NODES_ATTRIBUTE, List.of(1));
        elements.put("noType", noType);
        elements.put("blankType", element(" ", 1));
        elements.put("strange", element("flux_capacitor", 1));
        elements.put("B", element("bus", 1));

        ReportNode reportNode = TopologyAssert.createTestReportNode();
        NetworkModel model = NetworkModel.parse(elements, Map.of("1", List.of("B", "strange", "noType")),
                ElementBehaviorRegistry.createDefault(), reportNode);

        assertEquals(Set.of("strange", "B"), model.getElementIds());
        assertEquals(ElementType.UNKNOWN, model.getElement("strange").orElseThrow().getType());
        assertTrue(model.getBehavior(ElementType.UNKNOWN).isEmpty());
        assertEquals(List.of("B", "strange"), model.getElementIdsAtNode("1"));

        String report = TopologyAssert.printReport(reportNode);
        assertTrue(report.contains("Element notAMap skipped: data is not a map"));
        assertTrue(report.contains("Element noType skipped: type is missing"));
        assertTrue(report.contains("Element strange has unknown type flux_capacitor"));
        assertTrue(report.contains("1 reference(s) to unknown elements removed from node connections"));
    }

    @Test
    void testConnectionFiltering() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("A", element("bus", 1));
        elements.put("C", element("load", 1));
        elements.put("7", element("load", 7));
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("1", Arrays.asList("A", "C", "A", "missing"));
        nodes.put("7", List.of("7"));
        nodes.put("8", "A");
        nodes.put("9", List.of("missing"));

        NetworkModel model = NetworkModel.parse(elements, nodes);
        assertEquals(List.of("A", "C"), model.getElementIdsAtNode("1"));
        assertTrue(model.getNodeConnection("7").isEmpty());
        assertTrue(model.getNodeConnection("8").isEmpty());
        assertTrue(model.getNodeConnection("9").isEmpty());
        assertEquals(1, model.getNodeConnections().size());
        assertTrue(model.getNodeConnection("1").orElseThrow().contains("C"));
        assertFalse(model.isConnected("7"));
    }

    @Test
    void testNumericIdsAreStringified() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("10", element("bus", 1));
        elements.put("11", element("load", 1));
        NetworkModel model = NetworkModel.parse(elements, Map.of("1", List.of(10, 11)));
        assertEquals(List.of("10", "11"), model.getElementIdsAtNode("1"));
    }

    @Test
    void testLookupMiss() {
        NetworkModel model = TopologyNetworkFactory.createSingleSystem();
        assertTrue(model.getElement("unknown").isEmpty());
        assertTrue(model.getNodeConnection("42").isEmpty());
        assertTrue(model.getElementIdsAtNode("42").isEmpty());
        assertTrue(model.getNodeIdsOf("unknown").isEmpty());
        assertEquals(TopologyRole.NONE, model.getRole("unknown"));

        assertTrue(model.getElement(null).isEmpty());
        assertTrue(model.getNodeConnection(null).isEmpty());
        assertTrue(model.getNodeIdsOf(null).isEmpty());
        assertFalse(model.isConnected(null));
        assertEquals(TopologyRole.NONE, model.getRole(null));
    }

    @Test
    void testRoots() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("S3", element("system", 3));
        elements.put("S1", element("system", 1));
        elements.put("S2", element("system", 2));
        elements.put("B", element("bus", 1, 3));
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("1", List.of("S1", "B"));
        nodes.put("3", List.of("S3", "B"));

        NetworkModel model = NetworkModel.parse(elements, nodes);
        // S2 is not part of any node connection
        assertEquals(List.of("S1", "S3"), model.getRootElementIds());
    }

    @Test
    void testHardFailures() {
        Map<String, Object> nodes = Map.of();
        NetworkModelException e = assertThrows(NetworkModelException.class, () -> NetworkModel.parse(null, nodes));
        assertEquals("'elements' section is missing", e.getMessage());
        Map<String, Object> elements = Map.of("B", element("bus", 1));
        e = assertThrows(NetworkModelException.class, () -> NetworkModel.parse(elements, nodes, null));
        assertEquals("Element behavior registry is missing", e.getMessage());
    }

    @Test
    void testNoConnection() {
        NetworkModel model = NetworkModel.parse(Map.of("B", element("bus", 1)), null);
        assertTrue(model.getNodeConnections().isEmpty());
        assertTrue(model.getRootElementIds().isEmpty());
        assertEquals(1, model.getElements().size());
    }
}
