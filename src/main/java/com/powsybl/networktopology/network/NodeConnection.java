/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import java.util.List;
import java.util.Objects;

/**
 * A physical junction and the ids of the elements terminating at it, in input order.
 *
 * @param nodeId id of the junction
 * @param elementIds ids of known elements, without duplicates
 */
public record NodeConnection(String nodeId, List<String> elementIds) {

    public NodeConnection {
        Objects.requireNonNull(nodeId);
        elementIds = List.copyOf(elementIds);
    }

    public boolean contains(String elementId) {
        return elementIds.contains(elementId);
    }
}
