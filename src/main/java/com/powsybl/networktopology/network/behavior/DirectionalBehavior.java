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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Lines, transformers, switching devices: owned by the bus at their start node, they own the
 * buses at their end node.
 */
public class DirectionalBehavior extends AbstractElementBehavior {

    private static final Logger LOGGER = LoggerFactory.getLogger(DirectionalBehavior.class);

    @Override
    public TopologyRole getRole() {
        return TopologyRole.DIRECTIONAL;
    }

    @Override
    public boolean isDirectional() {
        return true;
    }

    @Override
    public List<String> getChildren(NetworkElement element, NetworkModel model) {
        OptionalInt endNode = element.getEndNode();
        if (endNode.isEmpty()) {
            LOGGER.warn("Cannot find end node of directional element '{}'", element.getId());
            return List.of();
        }
        Set<String> children = new LinkedHashSet<>();
        addElementsAtNode(model, String.valueOf(endNode.getAsInt()), element,
            id -> hasRole(model, id, TopologyRole.HUB), children);
        return new ArrayList<>(children);
    }
}
