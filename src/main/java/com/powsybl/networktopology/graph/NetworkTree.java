/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import java.util.*;

/**
 * Parent to children ownership relation of a network, with its roots. The relation comes from
 * element data and is not guaranteed to be acyclic.
 */
public final class NetworkTree {

    private final List<String> roots;

    private final List<String> nodes;

    private final Map<String, List<String>> children;

    public NetworkTree(List<String> roots, List<String> nodes, Map<String, List<String>> children) {
        this.roots = List.copyOf(Objects.requireNonNull(roots));
        this.nodes = List.copyOf(Objects.requireNonNull(nodes));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        Objects.requireNonNull(children).forEach((id, ids) -> copy.put(id, List.copyOf(ids)));
        this.children = Collections.unmodifiableMap(copy);
    }

    public List<String> getRoots() {
        return roots;
    }

    public List<String> getNodes() {
        return nodes;
    }

    /**
     * Children of the given element, empty if the element is unknown or a leaf.
     */
    public List<String> getChildren(String id) {
        return children.getOrDefault(id, List.of());
    }

    public Map<String, List<String>> getChildrenMap() {
        return children;
    }

    public int getEdgeCount() {
        int count = 0;
        for (List<String> ids : children.values()) {
            count += ids.size();
        }
        return count;
    }

    @Override
    public String toString() {
        return "NetworkTree(roots=" + roots + ", nodes=" + nodes.size() + ")";
    }
}
