/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import java.util.List;

/**
 * @param tree label of the tree holding the path
 * @param path values from the root to the target
 * @param length number of values in the path
 */
public record ShortestPath<V>(String tree, List<V> path, int length) {

    public ShortestPath {
        path = List.copyOf(path);
    }
}
