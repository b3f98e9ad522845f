/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology;

import com.powsybl.commons.config.PlatformConfig;

import java.util.Map;
import java.util.Optional;

import static com.powsybl.networktopology.util.ParameterConstants.*;

public class TopologyAnalysisParameters {

    private int threadCount = THREAD_COUNT_DEFAULT_VALUE;

    private boolean computeForestStatistics = COMPUTE_FOREST_STATISTICS_DEFAULT_VALUE;

    private boolean computeComponentReport = COMPUTE_COMPONENT_REPORT_DEFAULT_VALUE;

    public int getThreadCount() {
        return threadCount;
    }

    public TopologyAnalysisParameters setThreadCount(int threadCount) {
        if (threadCount < 1) {
            throw new IllegalArgumentException("Invalid thread count value: " + threadCount);
        }
        this.threadCount = threadCount;
        return this;
    }

    public boolean isComputeForestStatistics() {
        return computeForestStatistics;
    }

    public TopologyAnalysisParameters setComputeForestStatistics(boolean computeForestStatistics) {
        this.computeForestStatistics = computeForestStatistics;
        return this;
    }

    public boolean isComputeComponentReport() {
        return computeComponentReport;
    }

    public TopologyAnalysisParameters setComputeComponentReport(boolean computeComponentReport) {
        this.computeComponentReport = computeComponentReport;
        return this;
    }

    public static TopologyAnalysisParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static TopologyAnalysisParameters load(PlatformConfig platformConfig) {
        TopologyAnalysisParameters parameters = new TopologyAnalysisParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setThreadCount(config.getIntProperty(THREAD_COUNT_PARAM_NAME, THREAD_COUNT_DEFAULT_VALUE))
                        .setComputeForestStatistics(config.getBooleanProperty(COMPUTE_FOREST_STATISTICS_PARAM_NAME, COMPUTE_FOREST_STATISTICS_DEFAULT_VALUE))
                        .setComputeComponentReport(config.getBooleanProperty(COMPUTE_COMPONENT_REPORT_PARAM_NAME, COMPUTE_COMPONENT_REPORT_DEFAULT_VALUE)));
        return parameters;
    }

    public static TopologyAnalysisParameters load(Map<String, String> properties) {
        return new TopologyAnalysisParameters()
                .update(properties);
    }

    public TopologyAnalysisParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(THREAD_COUNT_PARAM_NAME))
                .ifPresent(value -> this.setThreadCount(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(COMPUTE_FOREST_STATISTICS_PARAM_NAME))
                .ifPresent(value -> this.setComputeForestStatistics(Boolean.parseBoolean(value)));
        Optional.ofNullable(properties.get(COMPUTE_COMPONENT_REPORT_PARAM_NAME))
                .ifPresent(value -> this.setComputeComponentReport(Boolean.parseBoolean(value)));
        return this;
    }

    @Override
    public String toString() {
        return "TopologyAnalysisParameters("
                + "threadCount=" + threadCount
                + ", computeForestStatistics=" + computeForestStatistics
                + ", computeComponentReport=" + computeComponentReport
                + ')';
    }
}
