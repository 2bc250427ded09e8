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
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SubmitOptions {

    public static final SubmitOptions DEFAULT = SubmitOptions.builder().build();

    @Builder.Default
    DeliveryMode mode = DeliveryMode.QUEUE;

    @Singular
    List<Attachment> attachments;

    public static SubmitOptions interrupt() {
        return SubmitOptions.builder().mode(DeliveryMode.INTERRUPT).build();
    }
}
