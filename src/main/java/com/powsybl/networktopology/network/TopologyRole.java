/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

/**
 * Role of an element category in the ownership tree.
 */
public enum TopologyRole {
    /**
     * Source element, root of an ownership tree.
     */
    SOURCE,
    /**
     * Undirected fan-out point.
     */
    HUB,
    /**
     * Two-terminal element oriented from its start node to its end node.
     */
    DIRECTIONAL,
    /**
     * Leaf device.
     */
    TERMINAL,
    NONE
}
