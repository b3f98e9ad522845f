/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.PowsyblException;
import com.powsybl.networktopology.forest.ForestStatistics;
import com.powsybl.networktopology.forest.TreeInfo;
import com.powsybl.networktopology.graph.ComponentReport;
import com.powsybl.networktopology.graph.NetworkTree;
import com.powsybl.networktopology.graph.SystemPair;
import com.powsybl.networktopology.graph.UndirectedNetworkGraph;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.*;

/**
 * JSON output of the topology analysis results, and reading of a reference ownership tree.
 */
public final class TopologyJsonSerializer {

    private static final String ROOTS = "roots";
    private static final String NODES = "nodes";
    private static final String TREE = "tree";
    private static final String CHILD = "child";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private TopologyJsonSerializer() {
    }

    @FunctionalInterface
    private interface JsonContentWriter {
        void write(JsonGenerator jsonGenerator) throws IOException;
    }

    private static void write(Writer writer, JsonContentWriter contentWriter) {
        Objects.requireNonNull(writer);
        try (JsonGenerator jsonGenerator = new JsonFactory()
                .createGenerator(writer)
                .useDefaultPrettyPrinter()) {
            jsonGenerator.writeStartObject();
            contentWriter.write(jsonGenerator);
            jsonGenerator.writeEndObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeStrings(JsonGenerator jsonGenerator, Collection<?> values) throws IOException {
        jsonGenerator.writeStartArray();
        for (Object value : values) {
            jsonGenerator.writeString(String.valueOf(value));
        }
        jsonGenerator.writeEndArray();
    }

    private static void writeStringsField(JsonGenerator jsonGenerator, String fieldName, Collection<?> values) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        writeStrings(jsonGenerator, values);
    }

    private static void writeNestedStrings(JsonGenerator jsonGenerator, String fieldName, Collection<? extends Collection<?>> values) throws IOException {
        jsonGenerator.writeFieldName(fieldName);
        jsonGenerator.writeStartArray();
        for (Collection<?> value : values) {
            writeStrings(jsonGenerator, value);
        }
        jsonGenerator.writeEndArray();
    }

    public static void writeTree(NetworkTree tree, Writer writer) {
        Objects.requireNonNull(tree);
        write(writer, jsonGenerator -> {
            writeStringsField(jsonGenerator, ROOTS, tree.getRoots());
            writeStringsField(jsonGenerator, NODES, tree.getNodes());
            jsonGenerator.writeFieldName(TREE);
            jsonGenerator.writeStartObject();
            for (Map.Entry<String, List<String>> e : tree.getChildrenMap().entrySet()) {
                jsonGenerator.writeFieldName(e.getKey());
                jsonGenerator.writeStartObject();
                writeStringsField(jsonGenerator, CHILD, e.getValue());
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndObject();
        });
    }

    public static void writeUndirectedGraph(UndirectedNetworkGraph graph, Writer writer) {
        Objects.requireNonNull(graph);
        write(writer, jsonGenerator -> {
            writeStringsField(jsonGenerator, NODES, graph.getNodes());
            writeNestedStrings(jsonGenerator, "edges", graph.getEdges());
        });
    }

    public static <V> void writeForestStatistics(ForestStatistics<V> statistics, Writer writer) {
        Objects.requireNonNull(statistics);
        write(writer, jsonGenerator -> {
            jsonGenerator.writeNumberField("totalRoots", statistics.totalRoots());
            jsonGenerator.writeFieldName("treesInfo");
            jsonGenerator.writeStartArray();
            for (TreeInfo<V> treeInfo : statistics.treesInfo()) {
                jsonGenerator.writeStartObject();
                jsonGenerator.writeStringField("root", String.valueOf(treeInfo.root()));
                jsonGenerator.writeNumberField("nodesCount", treeInfo.nodesCount());
                jsonGenerator.writeNumberField("depth", treeInfo.depth());
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();
            jsonGenerator.writeFieldName("sharedNodes");
            jsonGenerator.writeStartObject();
            for (Map.Entry<V, List<String>> e : statistics.sharedNodes().entrySet()) {
                writeStringsField(jsonGenerator, String.valueOf(e.getKey()), e.getValue());
            }
            jsonGenerator.writeEndObject();
        });
    }

    public static void writeComponentReport(ComponentReport report, Writer writer) {
        Objects.requireNonNull(report);
        write(writer, jsonGenerator -> {
            writeNestedStrings(jsonGenerator, "components", report.components());
            writeNestedStrings(jsonGenerator, "systemComponents", report.classification().systemComponents());
            writeNestedStrings(jsonGenerator, "orphanComponents", report.classification().orphanComponents());
            jsonGenerator.writeFieldName("connectingPaths");
            jsonGenerator.writeStartArray();
            for (Map.Entry<SystemPair, List<List<String>>> e : report.connectingPaths().entrySet()) {
                jsonGenerator.writeStartObject();
                jsonGenerator.writeStringField("system1", e.getKey().system1());
                jsonGenerator.writeStringField("system2", e.getKey().system2());
                writeNestedStrings(jsonGenerator, "paths", e.getValue());
                jsonGenerator.writeEndObject();
            }
            jsonGenerator.writeEndArray();
            writeStringsField(jsonGenerator, "unconnected", report.unconnected());
        });
    }

    /**
     * Read an ownership tree written by {@link #writeTree}.
     */
    public static NetworkTree readTree(Reader reader) {
        Objects.requireNonNull(reader);
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (root == null || !root.isObject()) {
            throw new PowsyblException("Tree document is not a JSON object");
        }
        List<String> roots = readStrings(root.get(ROOTS), ROOTS);
        List<String> nodes = readStrings(root.get(NODES), NODES);
        Map<String, List<String>> children = new LinkedHashMap<>();
        JsonNode treeNode = root.get(TREE);
        if (treeNode == null || !treeNode.isObject()) {
            throw new PowsyblException("'" + TREE + "' field is missing or is not an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = treeNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode childNode = field.getValue().get(CHILD);
            children.put(field.getKey(), childNode == null ? List.of() : readStrings(childNode, CHILD));
        }
        return new NetworkTree(roots, nodes, children);
    }

    private static List<String> readStrings(JsonNode arrayNode, String fieldName) {
        if (arrayNode == null || !arrayNode.isArray()) {
            throw new PowsyblException("'" + fieldName + "' field is missing or is not an array");
        }
        List<String> values = new ArrayList<>(arrayNode.size());
        for (JsonNode value : arrayNode) {
            values.add(value.asText());
        }
        return values;
    }
}
