package me.golemcore.krishi.infrastructure.event;

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
import me.golemcore.krishi.domain.model.ConsistencyWarning;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Logs {@link ConsistencyWarning} events and keeps the most recent ones for
 * inspection.
 */
@Component
@Slf4j
public class ConsistencyMonitor {

    static final int MAX_RECENT = 100;

    private final Deque<ConsistencyWarning> recent = new ArrayDeque<>();

    @EventListener
    public void onWarning(ConsistencyWarning warning) {
        log.warn("[Consistency] {} on '{}': {}", warning.kind(), warning.subject(), warning.detail());
        synchronized (recent) {
            recent.addLast(warning);
            while (recent.size() > MAX_RECENT) {
                recent.removeFirst();
            }
        }
    }

    /**
     * Recent warnings, oldest first.
     */
    public List<ConsistencyWarning> getRecentWarnings() {
        synchronized (recent) {
            return List.copyOf(recent);
        }
    }

    public void clear() {
        synchronized (recent) {
            recent.clear();
        }
    }
}
