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

import okio.BufferedSource;

import java.io.IOException;

/**
 * Minimal Server-Sent-Events line parser over an OkHttp body source.
 */
final class SseEventReader {

    @FunctionalInterface
    interface EventHandler {

        /**
         * @return false to stop reading
         */
        boolean onEvent(String event, String data);
    }

    private SseEventReader() {
    }

    static void read(BufferedSource source, EventHandler handler) throws IOException {
        String event = null;
        StringBuilder data = new StringBuilder();
        boolean hasData = false;
        String line;
        while ((line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                if (hasData && !handler.onEvent(event, data.toString())) {
                    return;
                }
                event = null;
                data.setLength(0);
                hasData = false;
                continue;
            }
            if (line.startsWith(":")) {
                continue;
            }
            int colon = line.indexOf(':');
            String field = colon >= 0 ? line.substring(0, colon) : line;
            String value = colon >= 0 ? line.substring(colon + 1) : "";
            if (value.startsWith(" ")) {
                value = value.substring(1);
            }
            switch (field) {
            case "event" -> event = value;
            case "data" -> {
                if (hasData) {
                    data.append('\n');
                }
                data.append(value);
                hasData = true;
            }
            default -> {
                // id and retry are not used
            }
            }
        }
        if (hasData) {
            handler.onEvent(event, data.toString());
        }
    }
}
