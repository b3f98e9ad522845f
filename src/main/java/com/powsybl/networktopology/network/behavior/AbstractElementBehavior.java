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
import java.util.Set;
import java.util.function.Predicate;

/**
 * Common neighborhood lookups shared by the behaviors.
 */
public abstract class AbstractElementBehavior implements ElementBehavior {

    @Override
    public boolean isRoot(NetworkElement element) {
        return false;
    }

    @Override
    public boolean isDirectional() {
        return false;
    }

    protected static boolean hasRole(NetworkModel model, String elementId, TopologyRole role) {
        return model.getRole(elementId) == role;
    }

    /**
     * Add to {@code children} the elements of the given node, other than {@code element}, accepted by the filter.
     */
    protected static void addElementsAtNode(NetworkModel model, String nodeId, NetworkElement element,
                                            Predicate<String> filter, Set<String> children) {
        List<String> elementIds = model.getElementIdsAtNode(nodeId);
        for (String elementId : elementIds) {
            if (!elementId.equals(element.getId()) && filter.test(elementId)) {
                children.add(elementId);
            }
        }
    }
}
