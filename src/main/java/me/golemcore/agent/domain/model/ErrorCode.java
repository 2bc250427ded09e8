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

/**
 * Machine-readable failure codes. Each code belongs to exactly one
 * {@link ErrorKind} and carries its retry policy.
 */
public enum ErrorCode {

    CONFIG_MISSING(ErrorKind.CONFIG, false),
    CONFIG_INVALID(ErrorKind.CONFIG, false),

    AUTH(ErrorKind.PROVIDER, false),
    RATE_LIMITED(ErrorKind.PROVIDER, true),
    OVERLOADED(ErrorKind.PROVIDER, true),
    SERVER_ERROR(ErrorKind.PROVIDER, true),
    MODEL_NOT_FOUND(ErrorKind.PROVIDER, false),
    INVALID_REQUEST(ErrorKind.PROVIDER, false),
    CONTENT_FILTERED(ErrorKind.PROVIDER, false),
    UNKNOWN(ErrorKind.PROVIDER, false),

    NETWORK(ErrorKind.REQUEST, true),
    TIMEOUT(ErrorKind.REQUEST, true),
    CONTEXT_LENGTH(ErrorKind.REQUEST, false),
    INVALID_INPUT(ErrorKind.REQUEST, false),
    CANCELLED(ErrorKind.REQUEST, false),

    HOOK_FAILED(ErrorKind.HOOK, false);

    private final ErrorKind kind;
    private final boolean retryable;

    ErrorCode(ErrorKind kind, boolean retryable) {
        this.kind = kind;
        this.retryable = retryable;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Lower-case dotted form used in logs and instrumentation, e.g.
     * {@code request.cancelled}.
     */
    public String wireName() {
        return kind.name().toLowerCase(Locale.ROOT) + "." + name().toLowerCase(Locale.ROOT);
    }
}
