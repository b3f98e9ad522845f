/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.forest;

import java.util.*;

/**
 * Cycle safe traversals of a forest node graph. Node identity is the node value.
 *
 * <p>{@link #collect} visits each value once for the whole traversal, {@link #walkPaths} only forbids
 * a value to appear twice along the current path.</p>
 */
public final class ForestTraverser {

    @FunctionalInterface
    public interface PathVisitor<V> {

        /**
         * Called for each path reached from the root, the last value being the one just entered.
         *
         * @return true to continue down this path
         */
        boolean visit(List<V> path);
    }

    private ForestTraverser() {
    }

    /**
     * Breadth first traversal returning, for each reachable value, the first node holding it.
     */
    public static <V> Map<V, ForestNode<V>> collectNodes(ForestNode<V> root) {
        Objects.requireNonNull(root);
        Map<V, ForestNode<V>> visited = new LinkedHashMap<>();
        Deque<ForestNode<V>> queue = new ArrayDeque<>();
        visited.put(root.getValue(), root);
        queue.add(root);
        while (!queue.isEmpty()) {
            ForestNode<V> node = queue.poll();
            for (ForestNode<V> child : node.getChildren()) {
                if (!visited.containsKey(child.getValue())) {
                    visited.put(child.getValue(), child);
                    queue.add(child);
                }
            }
        }
        return visited;
    }

    public static <V> Set<V> collect(ForestNode<V> root) {
        return new LinkedHashSet<>(collectNodes(root).keySet());
    }

    /**
     * Depth first enumeration of the simple paths starting at the root.
     */
    public static <V> void walkPaths(ForestNode<V> root, PathVisitor<V> visitor) {
        Objects.requireNonNull(root);
        Objects.requireNonNull(visitor);
        List<V> path = new ArrayList<>();
        List<V> pathView = Collections.unmodifiableList(path);
        Set<V> onPath = new HashSet<>();
        path.add(root.getValue());
        onPath.add(root.getValue());
        if (!visitor.visit(pathView)) {
            return;
        }
        Deque<Iterator<ForestNode<V>>> stack = new ArrayDeque<>();
        stack.push(root.getChildren().iterator());
        while (!stack.isEmpty()) {
            Iterator<ForestNode<V>> it = stack.peek();
            if (it.hasNext()) {
                ForestNode<V> child = it.next();
                V value = child.getValue();
                if (onPath.contains(value)) {
                    continue;
                }
                path.add(value);
                onPath.add(value);
                if (visitor.visit(pathView)) {
                    stack.push(child.getChildren().iterator());
                } else {
                    path.remove(path.size() - 1);
                    onPath.remove(value);
                }
            } else {
                stack.pop();
                onPath.remove(path.remove(path.size() - 1));
            }
        }
    }

    /**
     * Number of values of the longest simple path starting at the root, 1 for a lone root.
     */
    public static <V> int depth(ForestNode<V> root) {
        int[] depth = {0};
        walkPaths(root, path -> {
            depth[0] = Math.max(depth[0], path.size());
            return true;
        });
        return depth[0];
    }

    /**
     * Simple paths from the root to the target value. A path stops at the first occurrence of the target.
     */
    public static <V> List<List<V>> findPaths(ForestNode<V> root, V target) {
        Objects.requireNonNull(target);
        List<List<V>> paths = new ArrayList<>();
        walkPaths(root, path -> {
            if (target.equals(path.get(path.size() - 1))) {
                paths.add(List.copyOf(path));
                return false;
            }
            return true;
        });
        return paths;
    }
}
