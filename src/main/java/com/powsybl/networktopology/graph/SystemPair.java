/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import java.util.Objects;

/**
 * Two system elements of a same connected component, {@code system1} sorting before {@code system2}.
 */
public record SystemPair(String system1, String system2) {

    public SystemPair {
        Objects.requireNonNull(system1);
        Objects.requireNonNull(system2);
    }

    @Override
    public String toString() {
        return "(" + system1 + ", " + system2 + ")";
    }
}
