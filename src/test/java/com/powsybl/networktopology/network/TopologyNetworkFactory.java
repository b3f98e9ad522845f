/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import com.powsybl.networktopology.network.behavior.ElementBehaviorRegistry;

import java.util.*;

/**
 * Small network models used by tests.
 */
public final class TopologyNetworkFactory {

    private TopologyNetworkFactory() {
    }

    public static Map<String, Object> element(String type, Integer... nodes) {
        Map<String, Object> element = new LinkedHashMap<>();
        element.put(NetworkModel.TYPE_ATTRIBUTE, type);
        element.put(NetworkModel.NODES_ATTRIBUTE, Arrays.asList(nodes));
        return element;
    }

    /**
     * S - B - L - B2 - G, the line starting at the node of B and ending at the node of B2 and G.
     */
    public static NetworkModel createSingleSystem() {
        return createSingleSystem(ElementBehaviorRegistry.createDefault());
    }

    public static NetworkModel createSingleSystem(ElementBehaviorRegistry registry) {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("S", element("system", 1));
        elements.put("B", element("bus", 1));
        elements.put("L", element("overhead_line", 1, 2));
        elements.put("B2", element("bus", 2));
        elements.put("G", element("load", 2));
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("1", List.of("S", "B", "L"));
        nodes.put("2", List.of("L", "B2", "G"));
        return NetworkModel.parse(elements, nodes, registry);
    }

    /**
     * Two systems feeding the same bus B2 through L1 and L2, plus an orphan bus BX with a motor M.
     */
    public static NetworkModel createTwoSystems() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("S1", element("system", 1));
        elements.put("B1", element("bus", 1));
        elements.put("L1", element("overhead_line", 1, 2));
        elements.put("B2", element("bus", 2));
        elements.put("G", element("load", 2));
        elements.put("S2", element("system", 3));
        elements.put("B3", element("bus", 3));
        elements.put("L2", element("cable_line", 3, 2));
        elements.put("BX", element("bus", 9));
        elements.put("M", element("motor", 9));
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("1", List.of("S1", "B1", "L1"));
        nodes.put("2", List.of("L1", "B2", "G", "L2"));
        nodes.put("3", List.of("S2", "B3", "L2"));
        nodes.put("9", List.of("BX", "M"));
        return NetworkModel.parse(elements, nodes);
    }

    /**
     * A system and three elements P, Q and R sharing a node without any bus.
     */
    public static NetworkModel createBusless() {
        Map<String, Object> elements = new LinkedHashMap<>();
        elements.put("S", element("system", 1));
        elements.put("B", element("bus", 1));
        elements.put("P", element("generator", 5));
        elements.put("Q", element("load", 5));
        elements.put("R", element("switch", 5, 6));
        elements.put("I", element("reactor", 7));
        Map<String, Object> nodes = new LinkedHashMap<>();
        nodes.put("1", List.of("S", "B"));
        nodes.put("5", List.of("P", "Q", "R"));
        nodes.put("7", List.of("I"));
        return NetworkModel.parse(elements, nodes);
    }
}
