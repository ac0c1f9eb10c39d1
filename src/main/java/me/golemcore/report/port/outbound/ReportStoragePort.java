package me.golemcore.report.port.outbound;

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

import me.golemcore.report.domain.model.StoredReport;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persisting generated reports as text files.
 *
 * <p>
 * File names are plain names inside the output directory; implementations
 * reject anything containing path separators or {@code ..} with
 * {@link IllegalArgumentException}.
 */
public interface ReportStoragePort {

    /**
     * Write report text, replacing an existing file of the same name.
     */
    CompletableFuture<Void> save(String fileName, String content);

    /**
     * Read a report, empty when no such file exists.
     */
    CompletableFuture<Optional<String>> read(String fileName);

    /**
     * List stored reports, newest first.
     */
    CompletableFuture<List<StoredReport>> list();

    /**
     * Delete a report.
     *
     * @return {@code true} when a file was removed
     */
    CompletableFuture<Boolean> delete(String fileName);
}
