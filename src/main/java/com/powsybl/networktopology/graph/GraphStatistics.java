/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @param totalNodes number of nodes having at least one neighbor
 * @param totalEdges number of undirected edges
 * @param degreeDistribution degree of each node
 * @param components connected components, largest first
 */
public record GraphStatistics(int totalNodes, int totalEdges, Map<String, Integer> degreeDistribution,
                              List<Set<String>> components) {

    public int getComponentCount() {
        return components.size();
    }
}
