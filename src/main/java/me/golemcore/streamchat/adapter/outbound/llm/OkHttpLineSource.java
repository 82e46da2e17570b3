package me.golemcore.streamchat.adapter.outbound.llm;

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
import me.golemcore.streamchat.port.outbound.LineSource;
import okhttp3.Call;
import okhttp3.Response;
import okio.BufferedSource;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads an OkHttp response body line by line. Closing cancels the call, which
 * unblocks a read waiting for the next chunk.
 */
@Slf4j
class OkHttpLineSource implements LineSource {

    private final Call call;
    private final Response response;
    private final BufferedSource source;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    OkHttpLineSource(Call call, Response response) {
        this.call = call;
        this.response = response;
        this.source = response.body().source();
    }

    @Override
    public String readLine() throws IOException {
        if (closed.get()) {
            throw new IOException("Stream closed");
        }
        try {
            return source.readUtf8Line();
        } catch (IOException e) {
            if (call.isCanceled()) {
                throw new IOException("Stream cancelled", e);
            }
            throw e;
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        call.cancel();
        try {
            response.close();
        } catch (RuntimeException e) { // NOSONAR - body may already be torn down by the cancel
            log.debug("[Transport] Response close after cancel failed: {}", e.getMessage());
        }
    }
}
