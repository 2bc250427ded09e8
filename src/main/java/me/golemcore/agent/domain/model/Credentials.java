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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth tokens of the token-gated backend. Persisted as a single JSON file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Credentials {

    private String accessToken;
    private String refreshToken;
    private Instant expiresAt;
    private String accountId;

    /**
     * True when the access token is expired or expires within {@code skew}.
     */
    public boolean isExpiringWithin(Clock clock, Duration skew) {
        if (expiresAt == null) {
            return true;
        }
        return !Instant.now(clock).isBefore(expiresAt.minus(skew));
    }

    @Override
    public String toString() {
        return "Credentials{accountId=" + accountId + ", expiresAt=" + expiresAt + "}";
    }
}
