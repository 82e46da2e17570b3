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

/**
 * A data-driven classification rule. All pointers are JSON Pointers; when
 * {@link #eachElementOf} is set the rule runs once per element of that array and
 * every other pointer is resolved against the element.
 *
 * <p>
 * A rule applies when:
 * <ul>
 * <li>{@link #eventType} is unset or equals the parsed event type</li>
 * <li>{@link #requiredPointer} is unset or resolves to a non-null value</li>
 * <li>{@link #conditionPointer} is unset, or its text equals
 * {@link #conditionValue} (with {@link #conditionNegate}: is absent or
 * differs)</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PayloadMatcher {

    private CanonicalEventKind kind;

    private String eventType;
    private String eachElementOf;
    private String requiredPointer;

    private String conditionPointer;
    private String conditionValue;
    private boolean conditionNegate;

    private String textPointer;
    private String callIdPointer;
    private String namePointer;
    private String argumentsPointer;
    private String indexPointer;

    /** Message used for {@link CanonicalEventKind#FAILED} when no text is found. */
    private String defaultText;
    /** Put before the text found for {@link CanonicalEventKind#FAILED}. */
    private String failurePrefix;
}
