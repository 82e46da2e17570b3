package me.golemcore.streamchat.tools;

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

import me.golemcore.streamchat.domain.component.ToolComponent;
import me.golemcore.streamchat.domain.model.ToolDefinition;
import me.golemcore.streamchat.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reports the current date and time, in the requested timezone or the system
 * default.
 */
@Component
public class DateTimeTool implements ToolComponent {

    static final String NAME = "get_current_datetime";

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public DateTimeTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the current date and time. Use it whenever the answer depends on today's date.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "IANA timezone such as 'Europe/London' or 'UTC'. Defaults to the system timezone.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object requested = parameters.get("timezone");
        ZoneId zoneId;
        if (requested instanceof String timezone && !timezone.isBlank()) {
            try {
                zoneId = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                return CompletableFuture.completedFuture(ToolResult.failure("Invalid timezone: " + timezone));
            }
        } else {
            zoneId = clock.getZone();
        }

        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
        String output = "Current date and time: " + now.format(FORMATTER)
                + " (" + now.getDayOfWeek().name() + ", " + zoneId.getId() + ")";
        return CompletableFuture.completedFuture(ToolResult.success(output));
    }
}
