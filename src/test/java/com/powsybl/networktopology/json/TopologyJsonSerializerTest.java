/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.PowsyblException;
import com.powsybl.networktopology.TopologyAnalysis;
import com.powsybl.networktopology.TopologyAnalysisResult;
import com.powsybl.networktopology.graph.NetworkTree;
import com.powsybl.networktopology.graph.NetworkTreeComparator;
import com.powsybl.networktopology.network.NetworkModel;
import com.powsybl.networktopology.network.NetworkModelJsonReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TopologyJsonSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private TopologyAnalysisResult result;

    @BeforeEach
    void setUp() throws IOException {
        NetworkModel model;
        try (InputStream is = getClass().getResourceAsStream("/two-systems.json")) {
            model = NetworkModelJsonReader.read(is);
        }
        result = TopologyAnalysis.run(model);
    }

    private NetworkTree readReferenceTree() throws IOException {
        try (Reader reader = new InputStreamReader(getClass().getResourceAsStream("/two-systems-tree.json"), StandardCharsets.UTF_8)) {
            return TopologyJsonSerializer.readTree(reader);
        }
    }

    @Test
    void testTree() throws IOException {
        StringWriter writer = new StringWriter();
        TopologyJsonSerializer.writeTree(result.getTree(), writer);
        NetworkTree tree = TopologyJsonSerializer.readTree(new StringReader(writer.toString()));

        NetworkTree reference = readReferenceTree();
        assertEquals(List.of("S1", "S2"), reference.getRoots());
        assertTrue(NetworkTreeComparator.compare(tree, reference));
        assertTrue(NetworkTreeComparator.compare(result.getTree(), reference));
    }

    @Test
    void testUndirectedGraph() throws IOException {
        StringWriter writer = new StringWriter();
        TopologyJsonSerializer.writeUndirectedGraph(result.getGraph(), writer);
        JsonNode root = objectMapper.readTree(writer.toString());
        assertTrue(root.get("nodes").isArray());
        assertEquals(8, root.get("edges").size());
        assertEquals(2, root.get("edges").get(0).size());
    }

    @Test
    void testForestStatistics() throws IOException {
        StringWriter writer = new StringWriter();
        TopologyJsonSerializer.writeForestStatistics(result.getForestStatistics().orElseThrow(), writer);
        JsonNode root = objectMapper.readTree(writer.toString());
        assertEquals(2, root.get("totalRoots").asInt());
        JsonNode firstTree = root.get("treesInfo").get(0);
        assertEquals("S1", firstTree.get("root").asText());
        assertEquals(5, firstTree.get("nodesCount").asInt());
        assertEquals(5, firstTree.get("depth").asInt());
        assertEquals("Tree_1_S2", root.get("sharedNodes").get("B2").get(1).asText());
    }

    @Test
    void testComponentReport() throws IOException {
        StringWriter writer = new StringWriter();
        TopologyJsonSerializer.writeComponentReport(result.getComponentReport().orElseThrow(), writer);
        JsonNode root = objectMapper.readTree(writer.toString());
        assertEquals(2, root.get("components").size());
        assertEquals(1, root.get("systemComponents").size());
        assertEquals(1, root.get("orphanComponents").size());
        JsonNode connectingPath = root.get("connectingPaths").get(0);
        assertEquals("S1", connectingPath.get("system1").asText());
        assertEquals("S2", connectingPath.get("system2").asText());
        assertEquals(7, connectingPath.get("paths").get(0).size());
        assertEquals(2, root.get("unconnected").size());
    }

    @Test
    void testInvalidTree() {
        StringReader notAnObject = new StringReader("[]");
        PowsyblException e = assertThrows(PowsyblException.class, () -> TopologyJsonSerializer.readTree(notAnObject));
        assertEquals("Tree document is not a JSON object", e.getMessage());

        StringReader noTree = new StringReader("{\"roots\": [], \"nodes\": []}");
        e = assertThrows(PowsyblException.class, () -> TopologyJsonSerializer.readTree(noTree));
        assertEquals("'tree' field is missing or is not an object", e.getMessage());

        StringReader badRoots = new StringReader("{\"roots\": \"S\", \"nodes\": [], \"tree\": {}}");
        e = assertThrows(PowsyblException.class, () -> TopologyJsonSerializer.readTree(badRoots));
        assertEquals("'roots' field is missing or is not an array", e.getMessage());
    }
}
