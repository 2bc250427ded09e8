package me.golemcore.agent.adapter.outbound.transport;

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

import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Decides whether a failed candidate may hand the turn to the next one.
 * Cancellation never fails over.
 */
public final class FailoverPolicy {

    private static final Set<ErrorCode> DEFAULT_CODES = EnumSet.of(
            ErrorCode.NETWORK, ErrorCode.TIMEOUT, ErrorCode.OVERLOADED, ErrorCode.SERVER_ERROR);

    private final Set<ErrorCode> codes;

    private FailoverPolicy(Set<ErrorCode> codes) {
        this.codes = codes;
    }

    public static FailoverPolicy defaults() {
        return new FailoverPolicy(EnumSet.copyOf(DEFAULT_CODES));
    }

    public static FailoverPolicy never() {
        return new FailoverPolicy(EnumSet.noneOf(ErrorCode.class));
    }

    /**
     * @throws IllegalArgumentException
     *             on an unknown code name
     */
    public static FailoverPolicy of(Collection<String> codeNames) {
        Set<ErrorCode> codes = EnumSet.noneOf(ErrorCode.class);
        for (String name : codeNames) {
            codes.add(ErrorCode.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        }
        codes.remove(ErrorCode.CANCELLED);
        return new FailoverPolicy(codes);
    }

    public boolean shouldFailover(SdkError error) {
        return error != null && !error.isCancellation() && codes.contains(error.getCode());
    }

    public Set<ErrorCode> getCodes() {
        return Collections.unmodifiableSet(codes);
    }
}
