/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import java.util.Set;

/**
 * Values shared by the trees of two roots.
 */
public record RootConnection<V>(String tree1, String tree2, V root1, V root2, Set<V> commonNodes) {

    public RootConnection {
        commonNodes = Set.copyOf(commonNodes);
    }
}
