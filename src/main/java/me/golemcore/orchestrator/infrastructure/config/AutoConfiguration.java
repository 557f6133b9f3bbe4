package me.golemcore.orchestrator.infrastructure.config;

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
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.service.ToolDiscoveryService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration that provides shared infrastructure beans and prepares
 * the orchestrator on application startup.
 *
 * <p>
 * On startup this configuration:
 * <ul>
 * <li>Logs the reasoning model and tool backend settings</li>
 * <li>Discovers the tool backend's tools once and registers them</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final OrchestratorProperties properties;
    private final ToolDiscoveryService toolDiscoveryService;

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

    @PostConstruct
    public void init() {
        log.info("GolemCore Orchestrator starting...");
        log.info("Reasoning Model: {}", properties.getReasoning().getModel());
        log.info("Reasoning Endpoint: {}", properties.getReasoning().getBaseUrl());
        log.info("Max Input Length: {}", properties.getAdmission().getMaxInputLength());
        log.info("Max Body Bytes: {}", properties.getAdmission().getMaxBodyBytes());

        List<ToolDescriptor> tools = toolDiscoveryService.discover();
        log.info("Registered {} tools: {}", tools.size(), tools.stream().map(ToolDescriptor::getName).toList());

        log.info("GolemCore Orchestrator started successfully");
    }
}
