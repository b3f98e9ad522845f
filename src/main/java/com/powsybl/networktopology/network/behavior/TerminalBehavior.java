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
 * Generators, loads and other leaf devices.
 */
public class TerminalBehavior extends AbstractElementBehavior {

    @Override
    public TopologyRole getRole() {
        return TopologyRole.TERMINAL;
    }

    @Override
    public List<String> getChildren(NetworkElement element, NetworkModel model) {
        return List.of();
    }
}
