/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import java.util.List;
import java.util.Set;

public record ComponentClassification(List<Set<String>> systemComponents, List<Set<String>> orphanComponents) {

    public ComponentClassification {
        systemComponents = List.copyOf(systemComponents);
        orphanComponents = List.copyOf(orphanComponents);
    }
}
