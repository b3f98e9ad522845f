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
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * A bus fans out to the devices connected to it. Directional devices are owned only when they start
 * at the bus, terminal devices are always owned, systems and other buses never are.
 */
public class BusBehavior extends AbstractElementBehavior {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusBehavior.class);

    @Override
    public TopologyRole getRole() {
        return TopologyRole.HUB;
    }

    @Override
    public List<String> getChildren(NetworkElement element, NetworkModel model) {
        List<String> nodeIds = model.getNodeIdsOf(element.getId());
        if (nodeIds.isEmpty()) {
            LOGGER.debug("Bus '{}' is not part of any node connection", element.getId());
            return List.of();
        }
        Set<String> children = new LinkedHashSet<>();
        for (String nodeId : nodeIds) {
            addElementsAtNode(model, nodeId, element, id -> isChild(element, id, model), children);
        }
        LOGGER.debug("Bus '{}' owns {}", element.getId(), children);
        return new ArrayList<>(children);
    }

    private static boolean isChild(NetworkElement bus, String connectedId, NetworkModel model) {
        Optional<NetworkElement> connected = model.getElement(connectedId);
        if (connected.isEmpty()) {
            return false;
        }
        NetworkElement connectedElement = connected.get();
        Optional<ElementBehavior> behavior = model.getRegistry().getBehavior(connectedElement.getType());
        if (behavior.isEmpty()) {
            LOGGER.warn("Element '{}' connected to bus '{}' has no behavior for type {}, skipped",
                    connectedId, bus.getId(), connectedElement.getType());
            return false;
        }
        TopologyRole role = behavior.get().getRole();
        if (role == TopologyRole.SOURCE || role == TopologyRole.HUB) {
            return false;
        }
        if (behavior.get().isDirectional()) {
            return isStartNode(bus, connectedElement, model);
        }
        return true;
    }

    private static boolean isStartNode(NetworkElement bus, NetworkElement connected, NetworkModel model) {
        OptionalInt startNode = connected.getStartNode();
        if (startNode.isEmpty()) {
            LOGGER.warn("Element '{}' connected to bus '{}' has no node", connected.getId(), bus.getId());
            return false;
        }
        return model.getElementIdsAtNode(String.valueOf(startNode.getAsInt())).contains(bus.getId());
    }
}
