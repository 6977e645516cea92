package me.golemcore.orchestrator.port.outbound;

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

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Port for filesystem access by tools. Relative paths are resolved against the
 * working directory of the execution context by the caller; implementations
 * receive resolved paths.
 */
public interface FileSystemPort {

    String readFile(Path path) throws IOException;

    void writeFile(Path path, String content) throws IOException;

    boolean exists(Path path);

    void delete(Path path) throws IOException;

    /**
     * Lists direct children of a directory, sorted by name.
     */
    List<Path> list(Path directory) throws IOException;

    FileStat stat(Path path) throws IOException;

    /**
     * Basic file attributes.
     *
     * @param size
     *            size in bytes
     * @param directory
     *            whether the path is a directory
     * @param lastModified
     *            last modification time
     */
    record FileStat(long size, boolean directory, Instant lastModified) {
    }
}
