package me.golemcore.agent.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * Signals that work was stopped by a cancellation token.
 */
public class TurnCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    private final CancellationReason reason;

    public TurnCancelledException(CancellationReason reason) {
        super("Turn cancelled: " + reason.name().toLowerCase(Locale.ROOT));
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
