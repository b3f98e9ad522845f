/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import com.powsybl.networktopology.graph.NetworkTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public final class ForestNodes {

    private static final Logger LOGGER = LoggerFactory.getLogger(ForestNodes.class);

    private ForestNodes() {
    }

    /**
     * Materialize one node per element of the tree and return the root nodes. When the tree has no
     * root, elements which are nobody's child are used as roots.
     */
    public static List<ForestNode<String>> fromTree(NetworkTree tree) {
        Objects.requireNonNull(tree);
        Map<String, ForestNode<String>> nodes = new LinkedHashMap<>();
        for (String id : tree.getNodes()) {
            nodes.put(id, new ForestNode<>(id));
        }
        Set<String> childIds = new HashSet<>();
        for (Map.Entry<String, List<String>> e : tree.getChildrenMap().entrySet()) {
            ForestNode<String> parent = nodes.computeIfAbsent(e.getKey(), ForestNode::new);
            for (String childId : e.getValue()) {
                parent.addChild(nodes.computeIfAbsent(childId, ForestNode::new));
                childIds.add(childId);
            }
        }

        List<ForestNode<String>> roots = new ArrayList<>();
        if (!tree.getRoots().isEmpty()) {
            for (String rootId : tree.getRoots()) {
                roots.add(nodes.computeIfAbsent(rootId, ForestNode::new));
            }
        } else {
            for (ForestNode<String> node : nodes.values()) {
                if (!childIds.contains(node.getValue())) {
                    roots.add(node);
                }
            }
            LOGGER.warn("Tree has no root, {} elements without parent used as roots", roots.size());
        }
        return roots;
    }
}
