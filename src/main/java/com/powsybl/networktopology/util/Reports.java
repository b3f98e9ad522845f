/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

public final class Reports {

    private static final String ELEMENT_ID = "elementId";
    private static final String EDGE_COUNT = "edgeCount";

    private Reports() {
    }

    public static ReportNode createTopologyAnalysisReporter(ReportNode reportNode) {
        return reportNode.newReportNode()
                .withMessageTemplate("nt.topologyAnalysis")
                .add();
    }

    public static void reportModelSize(ReportNode reportNode, int elementCount, int connectionCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.modelSize")
                .withUntypedValue("elementCount", elementCount)
                .withUntypedValue("connectionCount", connectionCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportElementSkipped(ReportNode reportNode, String elementId, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.elementSkipped")
                .withUntypedValue(ELEMENT_ID, elementId)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportUnknownElementType(ReportNode reportNode, String elementId, String elementType) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.unknownElementType")
                .withUntypedValue(ELEMENT_ID, elementId)
                .withUntypedValue("elementType", elementType)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportDanglingReferences(ReportNode reportNode, int referenceCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.danglingReferences")
                .withUntypedValue("referenceCount", referenceCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportNoNodeConnection(ReportNode reportNode) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.noNodeConnection")
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportChildrenFailure(ReportNode reportNode, String elementId, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.childrenFailure")
                .withUntypedValue(ELEMENT_ID, elementId)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportTreeSize(ReportNode reportNode, int rootCount, int elementCount, int edgeCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.treeSize")
                .withUntypedValue("rootCount", rootCount)
                .withUntypedValue("elementCount", elementCount)
                .withUntypedValue(EDGE_COUNT, edgeCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportUndirectedGraphSize(ReportNode reportNode, int nodeCount, int edgeCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.undirectedGraphSize")
                .withUntypedValue("nodeCount", nodeCount)
                .withUntypedValue(EDGE_COUNT, edgeCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportForestStatistics(ReportNode reportNode, int rootCount, int sharedNodeCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.forestStatistics")
                .withUntypedValue("rootCount", rootCount)
                .withUntypedValue("sharedNodeCount", sharedNodeCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportComponents(ReportNode reportNode, int componentCount, int systemComponentCount, int orphanComponentCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.components")
                .withUntypedValue("componentCount", componentCount)
                .withUntypedValue("systemComponentCount", systemComponentCount)
                .withUntypedValue("orphanComponentCount", orphanComponentCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportUnconnectedElements(ReportNode reportNode, int unconnectedCount) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.unconnectedElements")
                .withUntypedValue("unconnectedCount", unconnectedCount)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportNoSystemInGraph(ReportNode reportNode) {
        reportNode.newReportNode()
                .withMessageTemplate("nt.noSystemInGraph")
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }
}
