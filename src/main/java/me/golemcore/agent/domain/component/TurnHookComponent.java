package me.golemcore.agent.domain.component;

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

import me.golemcore.agent.domain.model.ConversationState;
import me.golemcore.agent.domain.model.HookMessage;

import java.util.Optional;

/**
 * Callback invoked before each turn starts. A hook may contribute a message
 * that is delivered to the session's hook message sink. Any exception thrown
 * here is reported as a hook error carrying {@link #getComponentId()}.
 */
public interface TurnHookComponent extends Component {

    @Override
    default String getComponentType() {
        return "hook";
    }

    Optional<HookMessage> beforeTurn(String prompt, ConversationState conversation);
}
