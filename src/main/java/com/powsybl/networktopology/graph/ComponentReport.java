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
 * Connected components of an undirected graph, their classification, the shortest paths linking
 * systems of a same component and the elements connected to no system.
 */
public record ComponentReport(List<Set<String>> components,
                              ComponentClassification classification,
                              Map<SystemPair, List<List<String>>> connectingPaths,
                              Set<String> unconnected) {
}
