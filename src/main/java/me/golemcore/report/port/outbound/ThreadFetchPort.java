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

import me.golemcore.report.domain.model.RawThread;

import java.time.LocalDate;
import java.util.List;

/**
 * Port for reading daily report threads from a chat channel.
 */
public interface ThreadFetchPort {

    /**
     * Fetch the daily report threads posted in a channel between two dates.
     *
     * @param channel
     *            channel identifier, {@code null} for the configured default
     * @param from
     *            first day, inclusive
     * @param to
     *            last day, inclusive
     * @return threads in chronological order, each with its replies
     * @throws FetchException
     *             when the channel is unknown, the token is rejected or the
     *             platform cannot be reached
     */
    List<RawThread> fetchThreads(String channel, LocalDate from, LocalDate to);
}
