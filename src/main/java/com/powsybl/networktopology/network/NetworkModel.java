/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.network.behavior.ElementBehavior;
import com.powsybl.networktopology.network.behavior.ElementBehaviorRegistry;
import com.powsybl.networktopology.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * In-memory network model: elements indexed by id, node connections indexed by node id, and the
 * behavior registry used to interpret element categories. A model is immutable once parsed.
 */
public final class NetworkModel {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkModel.class);

    public static final String TYPE_ATTRIBUTE = "Type";
    public static final String NAME_ATTRIBUTE = "Name";
    public static final String NODES_ATTRIBUTE = "Nodes";

    private static final int DEFAULT_NAME_ID_LENGTH = 8;

    private final Map<String, NetworkElement> elements;

    private final Map<String, NodeConnection> nodeConnections;

    private final Map<String, List<String>> nodeIdsByElementId;

    private final ElementBehaviorRegistry registry;

    private final List<String> rootElementIds;

    private NetworkModel(Map<String, NetworkElement> elements, Map<String, NodeConnection> nodeConnections,
                         ElementBehaviorRegistry registry) {
        this.elements = Collections.unmodifiableMap(elements);
        this.nodeConnections = Collections.unmodifiableMap(nodeConnections);
        this.registry = registry;
        Map<String, List<String>> reverseIndex = new HashMap<>();
        for (NodeConnection connection : nodeConnections.values()) {
            for (String elementId : connection.elementIds()) {
                reverseIndex.computeIfAbsent(elementId, k -> new ArrayList<>()).add(connection.nodeId());
            }
        }
        reverseIndex.replaceAll((k, v) -> List.copyOf(v));
        this.nodeIdsByElementId = reverseIndex;
        this.rootElementIds = findRootElementIds();
    }

    public static NetworkModel parse(Map<String, ?> rawElements, Map<String, ?> rawConnections) {
        return parse(rawElements, rawConnections, ElementBehaviorRegistry.createDefault(), ReportNode.NO_OP);
    }

    public static NetworkModel parse(Map<String, ?> rawElements, Map<String, ?> rawConnections, ElementBehaviorRegistry registry) {
        return parse(rawElements, rawConnections, registry, ReportNode.NO_OP);
    }

    /**
     * Parse raw element and connection records. Malformed elements and dangling references are
     * skipped and logged, only a missing elements section or a missing registry is fatal.
     *
     * @param rawElements element id to attribute map ({@code Type}, {@code Name}, {@code Nodes}, ...)
     * @param rawConnections node id to list of element ids, may be null
     * @param registry behaviors used to interpret element categories
     * @param reportNode report node receiving parsing anomalies
     */
    public static NetworkModel parse(Map<String, ?> rawElements, Map<String, ?> rawConnections,
                                     ElementBehaviorRegistry registry, ReportNode reportNode) {
        Objects.requireNonNull(reportNode);
        if (registry == null) {
            throw new NetworkModelException("Element behavior registry is missing");
        }
        if (registry.isEmpty()) {
            LOGGER.warn("Element behavior registry is empty: no element will have children");
        }
        if (rawElements == null) {
            throw new NetworkModelException("'elements' section is missing");
        }
        Map<String, NetworkElement> elements = parseElements(rawElements, reportNode);
        Map<String, NodeConnection> nodeConnections;
        if (rawConnections == null) {
            LOGGER.warn("'nodes' section is missing, model has no node connection");
            nodeConnections = new LinkedHashMap<>();
        } else {
            nodeConnections = parseConnections(rawConnections, elements, reportNode);
        }
        if (nodeConnections.isEmpty()) {
            LOGGER.warn("No node connection could be built, check 'nodes' section of the model");
            Reports.reportNoNodeConnection(reportNode);
        }
        NetworkModel model = new NetworkModel(elements, nodeConnections, registry);
        LOGGER.info("Network model parsed: {} elements, {} node connections", elements.size(), nodeConnections.size());
        Reports.reportModelSize(reportNode, elements.size(), nodeConnections.size());
        return model;
    }

    private static Map<String, NetworkElement> parseElements(Map<String, ?> rawElements, ReportNode reportNode) {
        Map<String, NetworkElement> elements = new LinkedHashMap<>();
        for (Map.Entry<String, ?> e : rawElements.entrySet()) {
            String id = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Map<?, ?> rawAttributes)) {
                LOGGER.warn("Data of element '{}' is not a map, element skipped", id);
                Reports.reportElementSkipped(reportNode, id, "data is not a map");
                continue;
            }
            Object rawType = rawAttributes.get(TYPE_ATTRIBUTE);
            if (!(rawType instanceof String typeCode) || typeCode.isBlank()) {
                LOGGER.warn("Type of element '{}' is missing or invalid, element skipped", id);
                Reports.reportElementSkipped(reportNode, id, "type is missing");
                continue;
            }
            ElementType type = ElementType.fromCode(typeCode).orElse(null);
            if (type == null) {
                LOGGER.warn("Unknown type '{}' for element '{}'", typeCode, id);
                Reports.reportUnknownElementType(reportNode, id, typeCode);
                type = ElementType.UNKNOWN;
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            rawAttributes.forEach((k, v) -> attributes.put(String.valueOf(k), v));
            List<Integer> nodes = parseNodes(id, rawAttributes.get(NODES_ATTRIBUTE));
            Object rawName = rawAttributes.get(NAME_ATTRIBUTE);
            String name = rawName != null ? rawName.toString() : "Element_" + id.substring(0, Math.min(DEFAULT_NAME_ID_LENGTH, id.length()));
            elements.put(id, new NetworkElement(id, name, type, nodes, attributes));
            LOGGER.trace("Element added: id={}, type={}, nodes={}", id, type, nodes);
        }
        return elements;
    }

    private static boolean isIntegral(Object o) {
        return o instanceof Integer || o instanceof Long || o instanceof Short;
    }

    private static List<Integer> parseNodes(String elementId, Object rawNodes) {
        if (isIntegral(rawNodes)) {
            return List.of(((Number) rawNodes).intValue());
        }
        if (rawNodes instanceof Collection<?> rawNodeList) {
            List<Integer> nodes = new ArrayList<>(rawNodeList.size());
            for (Object rawNode : rawNodeList) {
                if (isIntegral(rawNode)) {
                    nodes.add(((Number) rawNode).intValue());
                } else {
                    LOGGER.warn("Non integer node '{}' of element '{}' ignored", rawNode, elementId);
                }
            }
            return nodes;
        }
        if (rawNodes != null) {
            LOGGER.debug("Nodes of element '{}' have an invalid format: {}", elementId, rawNodes);
        }
        return List.of();
    }

    private static Map<String, NodeConnection> parseConnections(Map<String, ?> rawConnections, Map<String, NetworkElement> elements,
                                                                ReportNode reportNode) {
        Map<String, NodeConnection> nodeConnections = new LinkedHashMap<>();
        int danglingReferenceCount = 0;
        for (Map.Entry<String, ?> e : rawConnections.entrySet()) {
            String nodeId = String.valueOf(e.getKey());
            if (!(e.getValue() instanceof Collection<?> rawElementIds)) {
                LOGGER.warn("Connected elements of node '{}' are not a list, node skipped", nodeId);
                continue;
            }
            Set<String> elementIds = new LinkedHashSet<>();
            for (Object rawElementId : rawElementIds) {
                String elementId = String.valueOf(rawElementId);
                if (elementId.equals(nodeId)) {
                    LOGGER.trace("Self reference of node '{}' ignored", nodeId);
                } else if (!elements.containsKey(elementId)) {
                    LOGGER.debug("Element '{}' referenced by node '{}' does not exist", elementId, nodeId);
                    danglingReferenceCount++;
                } else {
                    elementIds.add(elementId);
                }
            }
            if (!elementIds.isEmpty()) {
                nodeConnections.put(nodeId, new NodeConnection(nodeId, new ArrayList<>(elementIds)));
            }
        }
        if (danglingReferenceCount > 0) {
            LOGGER.warn("{} references to unknown elements removed from node connections", danglingReferenceCount);
            Reports.reportDanglingReferences(reportNode, danglingReferenceCount);
        }
        return nodeConnections;
    }

    private List<String> findRootElementIds() {
        List<String> roots = new ArrayList<>();
        for (NetworkElement element : elements.values()) {
            if (nodeIdsByElementId.containsKey(element.getId())
                    && registry.getBehavior(element.getType()).map(b -> b.isRoot(element)).orElse(false)) {
                roots.add(element.getId());
            }
        }
        Collections.sort(roots);
        if (roots.isEmpty()) {
            LOGGER.warn("No root element found in the model");
        }
        return Collections.unmodifiableList(roots);
    }

    /**
     * Element with the given id, empty when the id is null or unknown.
     */
    public Optional<NetworkElement> getElement(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(elements.get(id));
    }

    public Collection<NetworkElement> getElements() {
        return elements.values();
    }

    public Set<String> getElementIds() {
        return elements.keySet();
    }

    public Optional<ElementBehavior> getBehavior(ElementType type) {
        Optional<ElementBehavior> behavior = registry.getBehavior(type);
        if (behavior.isEmpty()) {
            LOGGER.warn("No behavior registered for element type {}", type);
        }
        return behavior;
    }

    public ElementBehaviorRegistry getRegistry() {
        return registry;
    }

    public Collection<NodeConnection> getNodeConnections() {
        return nodeConnections.values();
    }

    public Optional<NodeConnection> getNodeConnection(String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(nodeConnections.get(nodeId));
    }

    /**
     * Ids of the elements terminating at the given node, empty if the node is unknown.
     */
    public List<String> getElementIdsAtNode(String nodeId) {
        return getNodeConnection(nodeId).map(NodeConnection::elementIds).orElse(List.of());
    }

    /**
     * Ids of the node connections the given element belongs to, in connection order.
     */
    public List<String> getNodeIdsOf(String elementId) {
        return elementId == null ? List.of() : nodeIdsByElementId.getOrDefault(elementId, List.of());
    }

    public boolean isConnected(String elementId) {
        return elementId != null && nodeIdsByElementId.containsKey(elementId);
    }

    /**
     * Role of an element as given by the behavior registered for its category, so that a registry
     * may change the role of a category. {@link TopologyRole#NONE} for an unknown element or an
     * element without behavior.
     */
    public TopologyRole getRole(String elementId) {
        return getElement(elementId)
                .flatMap(element -> registry.getBehavior(element.getType()))
                .map(ElementBehavior::getRole)
                .orElse(TopologyRole.NONE);
    }

    /**
     * Elements whose behavior makes them roots and which belong to at least one node connection, sorted by id.
     */
    public List<String> getRootElementIds() {
        return rootElementIds;
    }
}
