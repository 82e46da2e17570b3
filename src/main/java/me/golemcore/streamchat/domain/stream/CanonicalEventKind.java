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

/**
 * Kinds of {@link CanonicalEvent} a {@link PayloadMatcher} can produce.
 */
public enum CanonicalEventKind {
    TEXT_DELTA,
    THINKING_STARTED,
    THINKING_DELTA,
    THINKING_FINISHED,
    TOOL_CALL,
    TOOL_CALL_FRAGMENT,
    TOOL_CALLS_FINISHED,
    COMPLETED,
    FAILED
}
