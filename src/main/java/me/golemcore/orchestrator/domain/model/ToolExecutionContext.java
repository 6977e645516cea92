package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;
import me.golemcore.orchestrator.port.outbound.CodeIntelligencePort;
import me.golemcore.orchestrator.port.outbound.ConfirmationPort;
import me.golemcore.orchestrator.port.outbound.FileSystemPort;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Everything a tool may touch while executing: filesystem, the optional
 * code-intelligence engine, the working directory, an optional confirmation
 * channel for destructive operations, a logger and an optional cancellation
 * signal.
 */
@Value
@Builder(toBuilder = true)
public class ToolExecutionContext {

    FileSystemPort fileSystem;
    CodeIntelligencePort codeIntelligence;
    Path workingDirectory;
    ConfirmationPort confirmation;
    Logger logger;
    CancellationSignal cancellationSignal;

    public Optional<CodeIntelligencePort> findCodeIntelligence() {
        return Optional.ofNullable(codeIntelligence);
    }

    public Optional<ConfirmationPort> findConfirmation() {
        return Optional.ofNullable(confirmation);
    }

    public boolean isCancelled() {
        return cancellationSignal != null && cancellationSignal.isCancelled();
    }

    /**
     * Resolves a tool-supplied path against the working directory.
     */
    public Path resolve(String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute() || workingDirectory == null) {
            return candidate.normalize();
        }
        return workingDirectory.resolve(candidate).normalize();
    }

    /**
     * Applies per-call overrides on top of this context.
     */
    public ToolExecutionContext merge(ExecutionOptions options) {
        if (options == null
                || (options.getWorkingDirectory() == null && options.getCancellationSignal() == null)) {
            return this;
        }
        ToolExecutionContextBuilder builder = toBuilder();
        if (options.getWorkingDirectory() != null) {
            builder.workingDirectory(options.getWorkingDirectory());
        }
        if (options.getCancellationSignal() != null) {
            builder.cancellationSignal(options.getCancellationSignal());
        }
        return builder.build();
    }
}
