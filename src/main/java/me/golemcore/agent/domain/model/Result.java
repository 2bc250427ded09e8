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

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or a classified {@link SdkError}. Public entry points return
 * this instead of throwing.
 *
 * @param <T>
 *            success value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Result<T> err(SdkError error) {
        return new Err<>(Objects.requireNonNull(error, "error"));
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * @return the success value
     * @throws SdkException
     *             if this is an error result
     */
    T getOrThrow();

    /**
     * @return the error, or {@code null} for a success result
     */
    SdkError errorOrNull();

    <R> Result<R> map(Function<? super T, ? extends R> mapper);

    record Ok<T>(T value) implements Result<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getOrThrow() {
            return value;
        }

        @Override
        public SdkError errorOrNull() {
            return null;
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Ok<>(mapper.apply(value));
        }
    }

    record Err<T>(SdkError error) implements Result<T> {

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getOrThrow() {
            throw new SdkException(error);
        }

        @Override
        public SdkError errorOrNull() {
            return error;
        }

        @Override
        public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
            return new Err<>(error);
        }
    }
}
