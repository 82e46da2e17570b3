package me.golemcore.streamchat.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A branch point in a conversation. Variants are append-only and never
 * reordered; {@link #activeVariantIndex} selects the one on the active path.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MessageNode {

    private String id;

    @Builder.Default
    private List<MessageVariant> variants = new ArrayList<>();

    private int activeVariantIndex;

    @JsonIgnore
    public MessageVariant getActiveVariant() {
        if (variants == null || activeVariantIndex < 0 || activeVariantIndex >= variants.size()) {
            return null;
        }
        return variants.get(activeVariantIndex);
    }

    @JsonIgnore
    public boolean isBranchPoint() {
        return variants != null && variants.size() > 1;
    }

    MessageNode copy() {
        List<MessageVariant> copiedVariants = new ArrayList<>();
        if (variants != null) {
            for (MessageVariant variant : variants) {
                copiedVariants.add(variant.toBuilder().build());
            }
        }
        return toBuilder().variants(copiedVariants).build();
    }
}
