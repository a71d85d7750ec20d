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

package me.golemcore.agent.port.outbound;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for file-like storage of agent data (sessions, action logs), addressed
 * by a top-level directory and a relative path.
 */
public interface StoragePort {

    /**
     * Stores text content, replacing any existing file.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Reads text content, completing with null when the file does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Appends text to a file, creating it when missing.
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Writes through a temp file and an atomic rename, so readers never see a
     * partially written file.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
