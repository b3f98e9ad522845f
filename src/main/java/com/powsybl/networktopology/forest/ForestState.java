/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a forest analysis: shared values with the labels of the trees holding them, and the
 * pairwise connections between roots.
 */
public final class ForestState<V> {

    private final Map<V, List<String>> sharedNodes;

    private final List<RootConnection<V>> connections;

    ForestState(Map<V, List<String>> sharedNodes, List<RootConnection<V>> connections) {
        Map<V, List<String>> copy = new LinkedHashMap<>();
        sharedNodes.forEach((value, labels) -> copy.put(value, List.copyOf(labels)));
        this.sharedNodes = Collections.unmodifiableMap(copy);
        this.connections = List.copyOf(connections);
    }

    public Map<V, List<String>> getSharedNodes() {
        return sharedNodes;
    }

    public List<RootConnection<V>> getConnections() {
        return connections;
    }
}
