/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.networktopology.network;

import com.powsybl.commons.PowsyblException;

/**
 * Raised when a network model cannot be built at all. Anomalies limited to a single element or
 * connection are not reported this way: they are skipped and logged.
 */
public class NetworkModelException extends PowsyblException {

    public NetworkModelException(String msg) {
        super(msg);
    }

    public NetworkModelException(String message, Throwable throwable) {
        super(message, throwable);
    }
}
