/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology;

import com.google.common.base.Stopwatch;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.forest.ForestAnalyzer;
import com.powsybl.networktopology.forest.ForestNodes;
import com.powsybl.networktopology.forest.ForestStatistics;
import com.powsybl.networktopology.graph.*;
import com.powsybl.networktopology.network.NetworkModel;
import com.powsybl.networktopology.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.powsybl.networktopology.util.Markers.PERFORMANCE_MARKER;

/**
 * Runs the whole topology pipeline on a network model: ownership tree, undirected graph, and
 * optionally forest statistics and component report.
 */
public final class TopologyAnalysis {

    private static final Logger LOGGER = LoggerFactory.getLogger(TopologyAnalysis.class);

    private TopologyAnalysis() {
    }

    public static TopologyAnalysisResult run(NetworkModel model) {
        return run(model, new TopologyAnalysisParameters(), ReportNode.NO_OP);
    }

    public static TopologyAnalysisResult run(NetworkModel model, TopologyAnalysisParameters parameters, ReportNode reportNode) {
        Objects.requireNonNull(model);
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(reportNode);
        LOGGER.info("Running topology analysis with {}", parameters);
        Stopwatch stopwatch = Stopwatch.createStarted();

        ReportNode analysisReportNode = Reports.createTopologyAnalysisReporter(reportNode);
        NetworkGraphBuilder builder = new NetworkGraphBuilder(model, analysisReportNode);
        NetworkTree tree = builder.buildTree();
        UndirectedNetworkGraph graph = builder.buildUndirectedGraph();

        ForestStatistics<String> forestStatistics = null;
        if (parameters.isComputeForestStatistics()) {
            try (ForestAnalyzer<String> forestAnalyzer = new ForestAnalyzer<>(ForestNodes.fromTree(tree), parameters.getThreadCount())) {
                forestStatistics = forestAnalyzer.getForestStatistics();
            }
            Reports.reportForestStatistics(analysisReportNode, forestStatistics.totalRoots(), forestStatistics.sharedNodes().size());
        }

        ComponentReport componentReport = null;
        if (parameters.isComputeComponentReport()) {
            componentReport = analyzeComponents(tree, graph, parameters, analysisReportNode);
        }

        stopwatch.stop();
        LOGGER.info(PERFORMANCE_MARKER, "Topology analysis done in {} ms", stopwatch.elapsed(TimeUnit.MILLISECONDS));
        return new TopologyAnalysisResult(tree, graph, forestStatistics, componentReport);
    }

    private static ComponentReport analyzeComponents(NetworkTree tree, UndirectedNetworkGraph graph,
                                                     TopologyAnalysisParameters parameters, ReportNode reportNode) {
        List<String> systemIds = tree.getRoots().stream().filter(graph::containsNode).toList();
        if (systemIds.isEmpty()) {
            LOGGER.warn("No system element in undirected graph, component analysis skipped");
            Reports.reportNoSystemInGraph(reportNode);
            return null;
        }
        ExecutorService executor = parameters.getThreadCount() > 1
                ? Executors.newFixedThreadPool(parameters.getThreadCount(), new ThreadFactoryBuilder()
                        .setNameFormat("graph-analyzer-%d")
                        .setDaemon(true)
                        .build())
                : null;
        try {
            ComponentReport componentReport = new UndirectedGraphAnalyzer(graph, systemIds, executor).analyze();
            ComponentClassification classification = componentReport.classification();
            Reports.reportComponents(reportNode, componentReport.components().size(),
                    classification.systemComponents().size(), classification.orphanComponents().size());
            if (!componentReport.unconnected().isEmpty()) {
                Reports.reportUnconnectedElements(reportNode, componentReport.unconnected().size());
            }
            return componentReport;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }
}
