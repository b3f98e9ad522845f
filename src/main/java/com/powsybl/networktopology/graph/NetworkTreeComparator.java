/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a computed ownership tree against a reference one. Child order is not significant.
 */
public final class NetworkTreeComparator {

    private static final Logger LOGGER = LoggerFactory.getLogger(NetworkTreeComparator.class);

    private NetworkTreeComparator() {
    }

    public static boolean compare(NetworkTree result, NetworkTree reference) {
        Objects.requireNonNull(result);
        Objects.requireNonNull(reference);
        boolean match = true;

        Set<String> resultRoots = new TreeSet<>(result.getRoots());
        Set<String> referenceRoots = new TreeSet<>(reference.getRoots());
        if (!resultRoots.equals(referenceRoots)) {
            LOGGER.warn("Roots mismatch: expected {}, got {}", referenceRoots, resultRoots);
            match = false;
        }

        if (result.getNodes().size() != reference.getNodes().size()) {
            LOGGER.warn("Node count mismatch: expected {}, got {}", reference.getNodes().size(), result.getNodes().size());
            match = false;
        }

        Set<String> resultNodes = new HashSet<>(result.getNodes());
        for (String id : reference.getNodes()) {
            if (!resultNodes.contains(id)) {
                LOGGER.warn("Node '{}' is missing", id);
                match = false;
                continue;
            }
            Set<String> expectedChildren = new TreeSet<>(reference.getChildren(id));
            Set<String> actualChildren = new TreeSet<>(result.getChildren(id));
            if (!expectedChildren.equals(actualChildren)) {
                LOGGER.warn("Children mismatch for node '{}': expected {}, got {}", id, expectedChildren, actualChildren);
                match = false;
            }
        }

        Set<String> referenceNodes = new HashSet<>(reference.getNodes());
        for (String id : result.getNodes()) {
            if (!referenceNodes.contains(id)) {
                LOGGER.warn("Unexpected node '{}'", id);
                match = false;
            }
        }

        if (match) {
            LOGGER.info("Tree matches reference ({} nodes, {} roots)", result.getNodes().size(), resultRoots.size());
        }
        return match;
    }
}
