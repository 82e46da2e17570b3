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

import me.golemcore.streamchat.port.outbound.LineSource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;

/**
 * {@link LineSource} over any {@link BufferedReader}.
 */
public class ReaderLineSource implements LineSource {

    private final BufferedReader reader;

    public ReaderLineSource(BufferedReader reader) {
        this.reader = reader;
    }

    public static ReaderLineSource of(String text) {
        return new ReaderLineSource(new BufferedReader(new StringReader(text)));
    }

    @Override
    public String readLine() throws IOException {
        return reader.readLine();
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
