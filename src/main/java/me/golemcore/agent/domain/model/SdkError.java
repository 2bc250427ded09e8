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

import lombok.Builder;
import lombok.Value;

/**
 * Normalized failure returned by every public entry point of the runtime.
 */
@Value
@Builder
public class SdkError {

    ErrorKind kind;
    ErrorCode code;
    String message;
    boolean retryable;

    /** Identity of the hook that failed, only set for {@link ErrorKind#HOOK}. */
    String hookId;

    public static SdkError of(ErrorCode code, String message) {
        return SdkError.builder()
                .kind(code.getKind())
                .code(code)
                .message(message)
                .retryable(code.isRetryable())
                .build();
    }

    public static SdkError config(ErrorCode code, String message) {
        requireKind(code, ErrorKind.CONFIG);
        return of(code, message);
    }

    public static SdkError provider(ErrorCode code, String message) {
        requireKind(code, ErrorKind.PROVIDER);
        return of(code, message);
    }

    public static SdkError request(ErrorCode code, String message) {
        requireKind(code, ErrorKind.REQUEST);
        return of(code, message);
    }

    public static SdkError hook(String hookId, String message) {
        return SdkError.builder()
                .kind(ErrorKind.HOOK)
                .code(ErrorCode.HOOK_FAILED)
                .message(message)
                .retryable(false)
                .hookId(hookId)
                .build();
    }

    public static SdkError cancelled(String message) {
        return of(ErrorCode.CANCELLED, message);
    }

    public boolean isCancellation() {
        return code == ErrorCode.CANCELLED;
    }

    private static void requireKind(ErrorCode code, ErrorKind expected) {
        if (code.getKind() != expected) {
            throw new IllegalArgumentException("Code " + code + " is not a " + expected + " error");
        }
    }

    @Override
    public String toString() {
        return "[" + code.wireName() + "] " + message;
    }
}
