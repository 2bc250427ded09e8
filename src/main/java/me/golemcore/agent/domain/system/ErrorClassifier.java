package me.golemcore.agent.domain.system;

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
import me.golemcore.agent.domain.model.HttpStatusException;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Normalizes any failure into exactly one {@link SdkError}.
 *
 * <p>
 * The cause chain is walked outermost first. For every link the classifier
 * tries, in order: an already classified {@link SdkException}, cancellation,
 * timeouts, HTTP status, langchain4j exception types, message patterns and
 * finally plain I/O failures. Anything unrecognised becomes a non-retryable
 * {@link ErrorCode#UNKNOWN} provider error.
 */
public final class ErrorClassifier {

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private static final List<String> RATE_LIMIT_PATTERNS = List.of(
            "rate limit", "too many requests", "exceeded your current quota");
    private static final List<String> AUTH_PATTERNS = List.of(
            "invalid api key", "unauthorized", "access denied");
    private static final List<String> OVERLOAD_PATTERNS = List.of(
            "overloaded", "at capacity", "service unavailable", "bad gateway");
    private static final List<String> CONTEXT_LENGTH_PATTERNS = List.of(
            "context length", "context window", "maximum context", "too many tokens", "token limit",
            "prompt is too long");
    private static final List<String> CONTENT_FILTER_PATTERNS = List.of(
            "content policy", "content_filter", "content filter");
    private static final List<String> NETWORK_PATTERNS = List.of(
            "connection reset", "connection refused", "broken pipe", "unexpected end of stream",
            "network error", "tls handshake timeout", "unknownhost");
    private static final List<String> TIMEOUT_PATTERNS = List.of(
            "timeout", "timed out", "deadline exceeded");

    private ErrorClassifier() {
    }

    public static SdkError classify(Throwable throwable) {
        if (throwable == null) {
            return SdkError.provider(ErrorCode.UNKNOWN, "Unknown error");
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);
            SdkError classified = classifyLink(current);
            if (classified != null) {
                return classified;
            }
            current = current.getCause();
        }
        return SdkError.provider(ErrorCode.UNKNOWN, describe(throwable));
    }

    /**
     * Maps an HTTP status answered by a backend.
     */
    public static SdkError classifyHttpStatus(int statusCode, String body) {
        String message = "HTTP " + statusCode + (body == null || body.isBlank() ? "" : ": " + abbreviate(body));
        if (statusCode == 429) {
            return SdkError.provider(ErrorCode.RATE_LIMITED, message);
        }
        if (statusCode == 401 || statusCode == 403) {
            return SdkError.provider(ErrorCode.AUTH, message);
        }
        if (statusCode == 404) {
            return SdkError.provider(ErrorCode.MODEL_NOT_FOUND, message);
        }
        if (statusCode == 408 || statusCode == 504) {
            return SdkError.request(ErrorCode.TIMEOUT, message);
        }
        if (statusCode == 413) {
            return SdkError.request(ErrorCode.CONTEXT_LENGTH, message);
        }
        if (statusCode == 503 || statusCode == 529) {
            return SdkError.provider(ErrorCode.OVERLOADED, message);
        }
        if (statusCode >= 500) {
            return SdkError.provider(ErrorCode.SERVER_ERROR, message);
        }
        if (statusCode >= 400) {
            SdkError byBody = classifyFromMessage(body);
            if (byBody != null && byBody.getCode() != ErrorCode.TIMEOUT && byBody.getCode() != ErrorCode.NETWORK) {
                return SdkError.of(byBody.getCode(), message);
            }
            return SdkError.provider(ErrorCode.INVALID_REQUEST, message);
        }
        return SdkError.provider(ErrorCode.UNKNOWN, message);
    }

    /**
     * Classifies a free-form diagnostic. Returns {@code null} when no pattern
     * matches.
     */
    public static SdkError classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return null;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (matches(normalized, CONTEXT_LENGTH_PATTERNS)) {
            return SdkError.request(ErrorCode.CONTEXT_LENGTH, message);
        }
        if (matches(normalized, CONTENT_FILTER_PATTERNS)) {
            return SdkError.provider(ErrorCode.CONTENT_FILTERED, message);
        }
        if (matches(normalized, RATE_LIMIT_PATTERNS)) {
            return SdkError.provider(ErrorCode.RATE_LIMITED, message);
        }
        if (matches(normalized, OVERLOAD_PATTERNS)) {
            return SdkError.provider(ErrorCode.OVERLOADED, message);
        }
        if (matches(normalized, AUTH_PATTERNS)) {
            return SdkError.provider(ErrorCode.AUTH, message);
        }
        if (matches(normalized, NETWORK_PATTERNS)) {
            return SdkError.request(ErrorCode.NETWORK, message);
        }
        if (matches(normalized, TIMEOUT_PATTERNS)) {
            return SdkError.request(ErrorCode.TIMEOUT, message);
        }
        return null;
    }

    private static SdkError classifyLink(Throwable throwable) {
        if (throwable instanceof SdkException) {
            return ((SdkException) throwable).getError();
        }
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return SdkError.cancelled(describe(throwable));
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return SdkError.request(ErrorCode.TIMEOUT, describe(throwable));
        }
        if (throwable instanceof HttpStatusException) {
            HttpStatusException http = (HttpStatusException) throwable;
            return classifyHttpStatus(http.statusCode(), http.body());
        }

        SdkError byType = classifyLangchain4j(throwable);
        if (byType != null) {
            return byType;
        }

        SdkError byMessage = classifyFromMessage(throwable.getMessage());
        if (byMessage != null) {
            return byMessage;
        }

        if (throwable instanceof IOException) {
            return SdkError.request(ErrorCode.NETWORK, describe(throwable));
        }
        return null;
    }

    private static SdkError classifyLangchain4j(Throwable throwable) {
        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return null;
        }
        String simpleName = className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length());
        String message = describe(throwable);
        return switch (simpleName) {
        case "RateLimitException" -> SdkError.provider(ErrorCode.RATE_LIMITED, message);
        case "TimeoutException" -> SdkError.request(ErrorCode.TIMEOUT, message);
        case "AuthenticationException" -> SdkError.provider(ErrorCode.AUTH, message);
        case "InvalidRequestException", "UnsupportedFeatureException" ->
            SdkError.provider(ErrorCode.INVALID_REQUEST, message);
        case "ModelNotFoundException" -> SdkError.provider(ErrorCode.MODEL_NOT_FOUND, message);
        case "ContentFilteredException" -> SdkError.provider(ErrorCode.CONTENT_FILTERED, message);
        case "InternalServerException" -> SdkError.provider(ErrorCode.SERVER_ERROR, message);
        case "UnresolvedModelServerException" -> SdkError.request(ErrorCode.NETWORK, message);
        case "HttpException" -> classifyLangchain4jHttp(throwable, message);
        default -> null;
        };
    }

    private static SdkError classifyLangchain4jHttp(Throwable throwable, String message) {
        Integer status = readHttpStatusCode(throwable);
        return status != null
                ? classifyHttpStatus(status, throwable.getMessage())
                : SdkError.provider(ErrorCode.UNKNOWN, message);
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static boolean matches(String normalized, List<String> patterns) {
        for (String pattern : patterns) {
            if (normalized.contains(pattern)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : throwable.getClass().getSimpleName();
    }

    private static String abbreviate(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
