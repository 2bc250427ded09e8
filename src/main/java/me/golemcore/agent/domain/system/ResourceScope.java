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

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Owns externally held resources (listeners, connections, timers) and releases
 * them in reverse registration order exactly once. A resource registered after
 * the scope closed is released immediately.
 */
@Slf4j
public final class ResourceScope implements AutoCloseable {

    private final String name;
    private final Deque<AutoCloseable> resources = new ArrayDeque<>();
    private boolean closed;

    public ResourceScope(String name) {
        this.name = name;
    }

    public <T extends AutoCloseable> T register(T resource) {
        boolean closeNow;
        synchronized (resources) {
            closeNow = closed;
            if (!closeNow) {
                resources.push(resource);
            }
        }
        if (closeNow) {
            closeQuietly(resource);
        }
        return resource;
    }

    /**
     * Forgets a resource that was released by its owner.
     */
    public void unregister(AutoCloseable resource) {
        synchronized (resources) {
            resources.remove(resource);
        }
    }

    public boolean isClosed() {
        synchronized (resources) {
            return closed;
        }
    }

    public int size() {
        synchronized (resources) {
            return resources.size();
        }
    }

    @Override
    public void close() {
        Deque<AutoCloseable> toClose;
        synchronized (resources) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayDeque<>(resources);
            resources.clear();
        }
        for (AutoCloseable resource : toClose) {
            closeQuietly(resource);
        }
        log.debug("[Scope] {} released {} resource(s)", name, toClose.size());
    }

    private void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) { // NOSONAR - release must continue for remaining resources
            log.warn("[Scope] {} failed to release {}: {}", name, resource, e.getMessage());
        }
    }
}
