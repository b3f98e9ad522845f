/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology;

import com.powsybl.networktopology.forest.ForestStatistics;
import com.powsybl.networktopology.graph.ComponentReport;
import com.powsybl.networktopology.graph.NetworkTree;
import com.powsybl.networktopology.graph.UndirectedNetworkGraph;

import java.util.Objects;
import java.util.Optional;

public class TopologyAnalysisResult {

    private final NetworkTree tree;

    private final UndirectedNetworkGraph graph;

    private final ForestStatistics<String> forestStatistics;

    private final ComponentReport componentReport;

    public TopologyAnalysisResult(NetworkTree tree, UndirectedNetworkGraph graph,
                                  ForestStatistics<String> forestStatistics, ComponentReport componentReport) {
        this.tree = Objects.requireNonNull(tree);
        this.graph = Objects.requireNonNull(graph);
        this.forestStatistics = forestStatistics;
        this.componentReport = componentReport;
    }

    public NetworkTree getTree() {
        return tree;
    }

    public UndirectedNetworkGraph getGraph() {
        return graph;
    }

    /**
     * Empty when forest statistics were not requested.
     */
    public Optional<ForestStatistics<String>> getForestStatistics() {
        return Optional.ofNullable(forestStatistics);
    }

    /**
     * Empty when the component report was not requested or when no system element is part of the graph.
     */
    public Optional<ComponentReport> getComponentReport() {
        return Optional.ofNullable(componentReport);
    }
}
