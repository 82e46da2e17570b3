package me.golemcore.streamchat.domain.stream;

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

import java.util.ArrayList;
import java.util.List;

/**
 * Provider-specific parameterization of the SSE wire format, plus the payload
 * matchers that classify its events. Dialects are static data loaded from
 * {@code dialects.json}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamDialect {

    public static final String DEFAULT_DONE_MARKER = "[DONE]";

    private String id;

    /** Field holding the event type, or {@code null} to discriminate by shape. */
    private String eventTypeField;

    @Builder.Default
    private String doneMarker = DEFAULT_DONE_MARKER;

    /** Ignore {@code :}-prefixed comment lines. */
    private boolean skipKeepalives;

    @Builder.Default
    private List<PayloadMatcher> matchers = new ArrayList<>();
}
