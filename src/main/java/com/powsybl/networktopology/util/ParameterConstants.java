/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.util;

/**
 * Names and default values of the topology analysis parameters.
 */
public final class ParameterConstants {

    public static final String MODULE_NAME = "network-topology-default-parameters";

    public static final String THREAD_COUNT_PARAM_NAME = "threadCount";
    public static final int MAX_DEFAULT_THREAD_COUNT = 8;
    public static final int THREAD_COUNT_DEFAULT_VALUE = Math.min(MAX_DEFAULT_THREAD_COUNT, Runtime.getRuntime().availableProcessors());

    public static final String COMPUTE_FOREST_STATISTICS_PARAM_NAME = "computeForestStatistics";
    public static final boolean COMPUTE_FOREST_STATISTICS_DEFAULT_VALUE = true;

    public static final String COMPUTE_COMPONENT_REPORT_PARAM_NAME = "computeComponentReport";
    public static final boolean COMPUTE_COMPONENT_REPORT_DEFAULT_VALUE = true;

    private ParameterConstants() {
    }
}
