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

import java.util.function.Function;

/**
 * Typed outcome of a branch operation. Structural problems are reported as
 * values and never thrown, so callers can show a precise message.
 *
 * @param <T>
 *            the value produced on success
 */
public sealed interface BranchResult<T> permits BranchResult.Success, BranchResult.NodeNotFound,
        BranchResult.IndexOutOfRange, BranchResult.CannotDeleteBranchPoint, BranchResult.ChatBusy,
        BranchResult.Error {

    static <T> BranchResult<T> success(T value) {
        return new Success<>(value);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the success value, or throws {@link IllegalStateException} with the
     * failure description.
     */
    default T getOrThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException(describe());
    }

    /**
     * Maps the success value; failures pass through with the new type.
     */
    @SuppressWarnings("unchecked")
    default <R> BranchResult<R> map(Function<T, R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return (BranchResult<R>) this;
    }

    String describe();

    record Success<T>(T value) implements BranchResult<T> {
        @Override
        public String describe() {
            return "OK";
        }
    }

    record NodeNotFound<T>(String reference) implements BranchResult<T> {
        @Override
        public String describe() {
            return "Node not found: " + reference;
        }
    }

    record IndexOutOfRange<T>(String nodeId, int index, int size) implements BranchResult<T> {
        @Override
        public String describe() {
            return "Variant index " + index + " out of range [0, " + size + ") at node " + nodeId;
        }
    }

    record CannotDeleteBranchPoint<T>(String nodeId, int variantCount) implements BranchResult<T> {
        @Override
        public String describe() {
            return "Cannot delete a message with " + variantCount + " variants; switch to the one to keep first";
        }
    }

    record ChatBusy<T>(String chatId) implements BranchResult<T> {
        @Override
        public String describe() {
            return "A response is still streaming in chat " + chatId;
        }
    }

    record Error<T>(String message) implements BranchResult<T> {
        @Override
        public String describe() {
            return message;
        }
    }
}
