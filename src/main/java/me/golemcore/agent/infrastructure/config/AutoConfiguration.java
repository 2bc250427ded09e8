package me.golemcore.agent.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.component.TurnHookComponent;
import me.golemcore.agent.domain.service.HookRegistry;
import me.golemcore.agent.domain.service.ToolRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans of the runtime and the startup summary.
 *
 * <p>
 * Tools and turn hooks are discovered as Spring beans implementing
 * {@link ToolComponent} and {@link TurnHookComponent}; invalid ones are
 * skipped by the registries and reported per session.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final RuntimeProperties properties;
    private final ModelCatalog modelCatalog;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * Timer for turn deadlines. Cancelled timers are removed at once so an
     * aborted turn leaves nothing scheduled.
     */
    @Bean(destroyMethod = "shutdownNow")
    public static ScheduledExecutorService turnScheduler() {
        AtomicInteger counter = new AtomicInteger();
        ScheduledThreadPoolExecutor executor = (ScheduledThreadPoolExecutor) Executors.newScheduledThreadPool(1,
                runnable -> {
                    Thread thread = new Thread(runnable, "agent-deadline-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Bean
    public ToolRegistry toolRegistry(ObjectProvider<ToolComponent> tools) {
        return new ToolRegistry(tools.orderedStream().toList(), properties.getSession().getToolTimeout());
    }

    @Bean
    public HookRegistry hookRegistry(ObjectProvider<TurnHookComponent> hooks, Clock clock) {
        return new HookRegistry(hooks.orderedStream().toList(), clock);
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Agent v{} starting...", version);
        log.info("Providers: {}", properties.getProviders().keySet());
        log.info("Model catalog: {} candidates", modelCatalog.getCandidates().size());
        log.info("Turn timeout: {}, max queued prompts: {}", properties.getSession().getTurnTimeout(),
                properties.getSession().getMaxQueuedPrompts());
    }
}
