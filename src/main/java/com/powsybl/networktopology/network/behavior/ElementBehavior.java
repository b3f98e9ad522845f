/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network.behavior;

import com.powsybl.networktopology.network.NetworkElement;
import com.powsybl.networktopology.network.NetworkModel;
import com.powsybl.networktopology.network.TopologyRole;

import java.util.List;

/**
 * Topological behavior of an element category: whether its elements are roots of the ownership
 * tree and how their children are found.
 * Implementations are stateless and may be shared by several categories and several models.
 */
public interface ElementBehavior {

    TopologyRole getRole();

    boolean isRoot(NetworkElement element);

    /**
     * Ids of the elements owned by the given element, in node order and without duplicates.
     */
    List<String> getChildren(NetworkElement element, NetworkModel model);

    boolean isDirectional();
}
