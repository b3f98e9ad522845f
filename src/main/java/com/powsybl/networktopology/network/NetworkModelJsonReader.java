/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.networktopology.network.behavior.ElementBehaviorRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a preconverted network document {@code {"elements": {...}, "nodes": {...}}}.
 */
public final class NetworkModelJsonReader {

    public static final String ELEMENTS_FIELD = "elements";
    public static final String NODES_FIELD = "nodes";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private NetworkModelJsonReader() {
    }

    public static NetworkModel read(InputStream is) {
        return read(is, ElementBehaviorRegistry.createDefault(), ReportNode.NO_OP);
    }

    @SuppressWarnings("unchecked")
    public static NetworkModel read(InputStream is, ElementBehaviorRegistry registry, ReportNode reportNode) {
        Objects.requireNonNull(is);
        Map<String, Object> document;
        try {
            document = OBJECT_MAPPER.readValue(is, new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new NetworkModelException("Cannot read network model: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new NetworkModelException("Network model document is empty");
        }
        Object elements = document.get(ELEMENTS_FIELD);
        if (elements != null && !(elements instanceof Map)) {
            throw new NetworkModelException("'" + ELEMENTS_FIELD + "' section is not an object");
        }
        Object nodes = document.get(NODES_FIELD);
        if (nodes != null && !(nodes instanceof Map)) {
            throw new NetworkModelException("'" + NODES_FIELD + "' section is not an object");
        }
        return NetworkModel.parse((Map<String, ?>) elements, (Map<String, ?>) nodes, registry, reportNode);
    }
}
