/*
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */

package com.powsybl.networktopology.util.mt;

import com.powsybl.commons.PowsyblException;
import com.powsybl.computation.CompletableFutureTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Runs one task per input on an executor and collects the results in input order.
 */
public final class ParallelTasks {

    private ParallelTasks() {
    }

    /**
     * Apply {@code task} to every input. When {@code executor} is null, tasks run inline in the
     * calling thread. The first task failure is rethrown as a {@link PowsyblException}, and no
     * partial result is ever returned.
     */
    public static <T, R> List<R> map(List<T> inputs, Function<? super T, ? extends R> task, Executor executor) {
        Objects.requireNonNull(inputs);
        Objects.requireNonNull(task);
        if (executor == null || inputs.size() <= 1) {
            List<R> results = new ArrayList<>(inputs.size());
            for (T input : inputs) {
                results.add(task.apply(input));
            }
            return results;
        }

        // results are pre-allocated so that each task writes to its own slot whatever the completion order
        List<R> results = Collections.synchronizedList(new ArrayList<>(Collections.nCopies(inputs.size(), null)));
        List<CompletableFuture<Void>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final int slot = i;
            T input = inputs.get(i);
            futures.add(CompletableFutureTask.runAsync(() -> {
                results.set(slot, task.apply(input));
                return null;
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(); // get instead of join to be notified of interruption
        } catch (InterruptedException e) {
            for (var future : futures) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new PowsyblException("Parallel computation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PowsyblException powsyblException) {
                throw powsyblException;
            }
            throw new PowsyblException("Parallel computation failed: " + cause.getMessage(), cause);
        }
        return new ArrayList<>(results);
    }
}
