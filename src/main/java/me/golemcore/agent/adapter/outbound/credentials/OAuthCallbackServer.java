package me.golemcore.agent.adapter.outbound.credentials;

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

import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.ErrorCode;
import me.golemcore.agent.domain.model.SdkError;
import me.golemcore.agent.domain.model.SdkException;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot loopback listener receiving the OAuth redirect.
 *
 * <p>
 * The first request on the callback path resolves {@link #authorizationCode()}
 * either with the code or with an error; the listener is then disposed. A
 * timeout or {@link #close()} before that rejects the future.
 */
@Slf4j
public final class OAuthCallbackServer implements AutoCloseable {

    private static final Duration BIND_TIMEOUT = Duration.ofSeconds(5);
    private static final String SUCCESS_PAGE = "<!DOCTYPE html><html><head><title>Signed in</title></head>"
            + "<body><h1>Authorization complete</h1><p>You can close this window and return to the terminal.</p>"
            + "</body></html>";

    private final String callbackPath;
    private final String expectedState;
    private final CompletableFuture<String> code = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean handled = new AtomicBoolean(false);
    private volatile DisposableServer server;
    private volatile Disposable timeoutTask;

    private OAuthCallbackServer(String callbackPath, String expectedState) {
        this.callbackPath = callbackPath;
        this.expectedState = expectedState;
    }

    /**
     * Binds the listener and arms its timeout.
     *
     * @param port
     *            0 picks an ephemeral port
     */
    public static OAuthCallbackServer start(String host, int port, String callbackPath, String expectedState,
            Duration timeout) {
        OAuthCallbackServer callback = new OAuthCallbackServer(callbackPath, expectedState);
        callback.server = HttpServer.create()
                .host(host)
                .port(port)
                .handle(callback::handle)
                .bindNow(BIND_TIMEOUT);
        callback.timeoutTask = Schedulers.parallel().schedule(callback::expire, timeout.toMillis(),
                TimeUnit.MILLISECONDS);
        log.debug("[OAuth] Callback listener on {}:{}{}", host, callback.port(), callbackPath);
        return callback;
    }

    public int port() {
        return server.port();
    }

    public CompletableFuture<String> authorizationCode() {
        return code;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Disposes the listener. Rejects a still pending code as cancelled.
     * Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Disposable timer = timeoutTask;
        if (timer != null) {
            timer.dispose();
        }
        code.completeExceptionally(new SdkException(SdkError.cancelled("Authorization flow cancelled")));
        DisposableServer current = server;
        if (current != null) {
            current.dispose();
        }
        log.debug("[OAuth] Callback listener closed");
    }

    private Publisher<Void> handle(HttpServerRequest request, HttpServerResponse response) {
        QueryStringDecoder decoder = new QueryStringDecoder(request.uri());
        if (!callbackPath.equals(decoder.path())) {
            return respond(response, HttpResponseStatus.NOT_FOUND, "Not found");
        }
        if (!handled.compareAndSet(false, true)) {
            return respond(response, HttpResponseStatus.GONE, "Authorization already handled");
        }

        Map<String, List<String>> params = decoder.parameters();
        String state = first(params, "state");
        String authorizationCode = first(params, "code");
        String error = first(params, "error");

        if (state == null || !state.equals(expectedState)) {
            log.warn("[OAuth] Callback state mismatch");
            return finish(response, HttpResponseStatus.BAD_REQUEST, "State mismatch",
                    SdkError.provider(ErrorCode.AUTH, "OAuth state mismatch"));
        }
        if (error != null) {
            return finish(response, HttpResponseStatus.BAD_REQUEST, "Authorization failed",
                    SdkError.provider(ErrorCode.AUTH, "Authorization failed: " + error));
        }
        if (authorizationCode == null || authorizationCode.isBlank()) {
            return finish(response, HttpResponseStatus.BAD_REQUEST, "Missing authorization code",
                    SdkError.provider(ErrorCode.AUTH, "Callback carried no authorization code"));
        }
        return finish(response, HttpResponseStatus.OK, SUCCESS_PAGE, null)
                .doOnSubscribe(subscription -> code.complete(authorizationCode));
    }

    private Mono<Void> finish(HttpServerResponse response, HttpResponseStatus status, String body,
            SdkError failure) {
        if (failure != null) {
            code.completeExceptionally(new SdkException(failure));
        }
        return respond(response, status, body)
                .doFinally(signal -> Schedulers.boundedElastic().schedule(this::close));
    }

    private static Mono<Void> respond(HttpServerResponse response, HttpResponseStatus status, String body) {
        return response.status(status)
                .header("Content-Type", "text/html; charset=utf-8")
                .sendString(Mono.just(body))
                .then();
    }

    private void expire() {
        if (code.completeExceptionally(new SdkException(SdkError.request(ErrorCode.TIMEOUT,
                "Timed out waiting for the authorization callback")))) {
            log.warn("[OAuth] Timed out waiting for the authorization callback");
        }
        close();
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
