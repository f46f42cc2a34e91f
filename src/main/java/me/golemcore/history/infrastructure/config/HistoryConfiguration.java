package me.golemcore.history.infrastructure.config;

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

import me.golemcore.history.port.outbound.HistorySourcePort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared beans and startup logging for the history service.
 *
 * <p>
 * Logs the resolved location of every source family on startup so that a
 * missing source can be diagnosed from the log alone; absent locations are not
 * an error.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class HistoryConfiguration {

    private final HistoryProperties properties;
    private final List<HistorySourcePort> sourcePorts;

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
        log.info("GolemCore History starting...");
        log.info("Transcripts base: {}", properties.resolvePath(properties.getTranscripts().getProjectsDir()));
        log.info("Tracking store: {}", properties.resolvePath(properties.getTrackingStore().getPath()));
        log.info("Artifact brain dir: {}", properties.resolvePath(properties.getAntigravity().getBrainDir()));
        log.info("Scan budget: {} (max depth {})", properties.getScan().getTimeout(),
                properties.getScan().getMaxDepth());
        log.info("Registered history sources: {}", sourcePorts.stream()
                .map(port -> port.getSource().getTag())
                .toList());
    }
}
