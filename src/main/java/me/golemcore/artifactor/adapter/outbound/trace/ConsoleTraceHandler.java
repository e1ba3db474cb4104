package me.golemcore.artifactor.adapter.outbound.trace;

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
import me.golemcore.artifactor.domain.model.TraceEvent;
import me.golemcore.artifactor.port.outbound.TraceHandler;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes each trace event as a single {@code key=value} log line.
 */
@Component
@Slf4j
public class ConsoleTraceHandler implements TraceHandler {

    public static final String NAME = "console";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public CompletableFuture<Void> handle(TraceEvent event) {
        log.info(format(event));
        return CompletableFuture.completedFuture(null);
    }

    static String format(TraceEvent event) {
        StringBuilder line = new StringBuilder()
                .append("trace_type=").append(event.type().wireValue())
                .append(" trace_id=").append(event.traceId())
                .append(" category=").append(event.category().wireValue());
        for (Map.Entry<String, Object> entry : event.data().entrySet()) {
            line.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
        }
        return line.toString();
    }
}
