/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A value with an ordered list of children. Children links may form cycles, traversals identify
 * nodes by value.
 *
 * @param <V> node value type
 */
public final class ForestNode<V> {

    private final V value;

    private final List<ForestNode<V>> children = new ArrayList<>();

    public ForestNode(V value) {
        this.value = Objects.requireNonNull(value);
    }

    public V getValue() {
        return value;
    }

    public List<ForestNode<V>> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ForestNode<V> addChild(ForestNode<V> child) {
        children.add(Objects.requireNonNull(child));
        return this;
    }

    @Override
    public String toString() {
        return "ForestNode(" + value + ")";
    }
}
