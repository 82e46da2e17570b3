package me.golemcore.streamchat.port.outbound;

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

import java.io.Closeable;
import java.io.IOException;

/**
 * A readable line stream. The wire parser makes no assumptions about what is
 * behind it: a chunked HTTP response, a local pipe, or a test fixture.
 *
 * <p>
 * {@link #close()} may be called from another thread to abort a blocked
 * {@link #readLine()}, which then fails with an {@link IOException}.
 */
public interface LineSource extends Closeable {

    /**
     * Reads the next line without its terminator.
     *
     * @return the line, or {@code null} once the stream is exhausted
     */
    String readLine() throws IOException;
}
