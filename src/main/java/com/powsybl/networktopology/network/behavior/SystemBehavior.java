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
import java.util.Set;

/**
 * A power system equivalent: always a root, owns the buses it is connected to.
 */
public class SystemBehavior extends AbstractElementBehavior {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemBehavior.class);

    @Override
    public TopologyRole getRole() {
        return TopologyRole.SOURCE;
    }

    @Override
    public boolean isRoot(NetworkElement element) {
        return true;
    }

    @Override
    public List<String> getChildren(NetworkElement element, NetworkModel model) {
        Set<String> children = new LinkedHashSet<>();
        for (String nodeId : model.getNodeIdsOf(element.getId())) {
            addElementsAtNode(model, nodeId, element, id -> hasRole(model, id, TopologyRole.HUB), children);
        }
        LOGGER.debug("System '{}' owns buses {}", element.getId(), children);
        return new ArrayList<>(children);
    }
}
