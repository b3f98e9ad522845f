/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network.behavior;

import com.powsybl.networktopology.network.ElementType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from element category to behavior. A registry is built once and handed to the
 * models which need it, different models may use different registries.
 */
public final class ElementBehaviorRegistry {

    private final Map<ElementType, ElementBehavior> behaviors;

    private ElementBehaviorRegistry(Map<ElementType, ElementBehavior> behaviors) {
        this.behaviors = Collections.unmodifiableMap(behaviors);
    }

    public static ElementBehaviorRegistry empty() {
        return new ElementBehaviorRegistry(new EnumMap<>(ElementType.class));
    }

    /**
     * Registry covering every known category. {@link ElementType#UNKNOWN} is left unmapped so that
     * elements of unrecognized type are handled as isolated leaves.
     */
    public static ElementBehaviorRegistry createDefault() {
        ElementBehavior system = new SystemBehavior();
        ElementBehavior bus = new BusBehavior();
        ElementBehavior directional = new DirectionalBehavior();
        ElementBehavior terminal = new TerminalBehavior();
        Map<ElementType, ElementBehavior> behaviors = new EnumMap<>(ElementType.class);
        for (ElementType type : ElementType.values()) {
            switch (type.getRole()) {
                case SOURCE -> behaviors.put(type, system);
                case HUB -> behaviors.put(type, bus);
                case DIRECTIONAL -> behaviors.put(type, directional);
                case TERMINAL -> behaviors.put(type, terminal);
                case NONE -> {
                    // not mapped
                }
            }
        }
        return new ElementBehaviorRegistry(behaviors);
    }

    /**
     * Copy of this registry with the given behavior registered for the given category.
     */
    public ElementBehaviorRegistry with(ElementType type, ElementBehavior behavior) {
        Objects.requireNonNull(type);
        Objects.requireNonNull(behavior);
        Map<ElementType, ElementBehavior> copy = new EnumMap<>(ElementType.class);
        copy.putAll(behaviors);
        copy.put(type, behavior);
        return new ElementBehaviorRegistry(copy);
    }

    public Optional<ElementBehavior> getBehavior(ElementType type) {
        Objects.requireNonNull(type);
        return Optional.ofNullable(behaviors.get(type));
    }

    public Set<ElementType> getRegisteredTypes() {
        return behaviors.keySet();
    }

    public boolean isEmpty() {
        return behaviors.isEmpty();
    }
}
