/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Electrical element categories as they appear in the {@code Type} attribute of a model.
 */
public enum ElementType {
    SYSTEM("system", TopologyRole.SOURCE),
    BUS("bus", TopologyRole.HUB),
    OVERHEAD_LINE("overhead_line", TopologyRole.DIRECTIONAL),
    CABLE_LINE("cable_line", TopologyRole.DIRECTIONAL),
    TRANSFORMER2("transformer2", TopologyRole.DIRECTIONAL),
    TRANSFORMER2SW("transformer2sw", TopologyRole.DIRECTIONAL),
    TRANSFORMER3("transformer3", TopologyRole.DIRECTIONAL),
    AUTOTRANSFORMER("autotransformer", TopologyRole.DIRECTIONAL),
    SWITCH("switch", TopologyRole.DIRECTIONAL),
    BREAKER("breaker", TopologyRole.DIRECTIONAL),
    DISCONNECTOR("disconnector", TopologyRole.DIRECTIONAL),
    CORRIDOR("corridor", TopologyRole.DIRECTIONAL),
    GENERATOR("generator", TopologyRole.TERMINAL),
    LOAD("load", TopologyRole.TERMINAL),
    MOTOR("motor", TopologyRole.TERMINAL),
    CAPACITOR_BANK("capacitor_bank", TopologyRole.TERMINAL),
    SHORT_CIRCUIT("short_circuit", TopologyRole.TERMINAL),
    REACTOR("reactor", TopologyRole.TERMINAL),
    COIL("coil", TopologyRole.TERMINAL),
    UNKNOWN("unknown", TopologyRole.NONE);

    private static final Map<String, ElementType> BY_CODE = Arrays.stream(values())
            .collect(Collectors.toMap(ElementType::getCode, Function.identity()));

    private final String code;

    private final TopologyRole role;

    ElementType(String code, TopologyRole role) {
        this.code = code;
        this.role = role;
    }

    public String getCode() {
        return code;
    }

    public TopologyRole getRole() {
        return role;
    }

    /**
     * Find the category matching a raw {@code Type} attribute, case is significant.
     */
    public static Optional<ElementType> fromCode(String code) {
        Objects.requireNonNull(code);
        return Optional.ofNullable(BY_CODE.get(code));
    }
}
