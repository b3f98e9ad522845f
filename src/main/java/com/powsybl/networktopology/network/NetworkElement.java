/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * An element of a network model. Instances are immutable and owned by a {@link NetworkModel}.
 */
public final class NetworkElement {

    private final String id;

    private final String name;

    private final ElementType type;

    private final List<Integer> nodes;

    private final Map<String, Object> attributes;

    public NetworkElement(String id, String name, ElementType type, List<Integer> nodes, Map<String, Object> attributes) {
        this.id = Objects.requireNonNull(id);
        this.name = Objects.requireNonNull(name);
        this.type = Objects.requireNonNull(type);
        this.nodes = List.copyOf(nodes);
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(attributes)));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public ElementType getType() {
        return type;
    }

    public List<Integer> getNodes() {
        return nodes;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getAttribute(String name) {
        Objects.requireNonNull(name);
        return attributes.get(name);
    }

    /**
     * First listed node, where a directional element starts.
     */
    public OptionalInt getStartNode() {
        return nodes.isEmpty() ? OptionalInt.empty() : OptionalInt.of(nodes.get(0));
    }

    /**
     * Second listed node, or the only one when the element has a single node.
     */
    public OptionalInt getEndNode() {
        if (nodes.isEmpty()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(nodes.size() >= 2 ? nodes.get(1) : nodes.get(0));
    }

    @Override
    public String toString() {
        return "NetworkElement(id=" + id + ", type=" + type + ", nodes=" + nodes + ")";
    }
}
