package me.golemcore.report.adapter.outbound.slack;

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

import me.golemcore.report.domain.model.RawReply;
import me.golemcore.report.domain.model.RawThread;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.FetchException;
import me.golemcore.report.port.outbound.ThreadFetchPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

/**
 * Reads daily report threads from a Slack channel.
 *
 * <p>
 * Flow:
 * <ol>
 * <li>page through {@code conversations.history} for the date range</li>
 * <li>keep top-level messages whose text matches
 * {@code report.slack.header-pattern}</li>
 * <li>fetch each thread's replies in parallel, at most
 * {@code report.slack.fetch-parallelism} at a time</li>
 * <li>resolve user ids to names through a shared cache and strip Slack
 * markup</li>
 * </ol>
 * The thread date is read from the header text and falls back to the day the
 * header was posted. Threads are returned oldest first.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackThreadFetcher implements ThreadFetchPort {

    private static final Set<String> SKIPPED_SUBTYPES = Set.of("channel_join", "channel_leave", "channel_topic",
            "channel_purpose", "thread_broadcast");

    private final SlackApiClient slackApiClient;
    private final SlackTextNormalizer textNormalizer;
    private final SlackHeaderDateParser headerDateParser;
    private final ReportProperties properties;

    private final Map<String, String> userNames = new ConcurrentHashMap<>();

    @Override
    public List<RawThread> fetchThreads(String channel, LocalDate from, LocalDate to) {
        ReportProperties.SlackProperties slack = properties.getSlack();
        String channelId = channel != null && !channel.isBlank() ? channel : slack.getChannelId();
        if (channelId == null || channelId.isBlank()) {
            throw new FetchException("No Slack channel configured (report.slack.channel-id)");
        }

        ZoneId zone = ZoneId.of(slack.getZoneId());
        String oldest = String.valueOf(from.atStartOfDay(zone).toEpochSecond());
        String latest = String.valueOf(to.plusDays(1).atStartOfDay(zone).toEpochSecond() - 1);

        List<SlackApiClient.SlackMessage> headers = findHeaders(channelId, oldest, latest);
        log.info("[Slack] Found {} daily report threads in {} between {} and {}", headers.size(), channelId, from,
                to);
        if (headers.isEmpty()) {
            return List.of();
        }

        int parallelism = Math.max(1, Math.min(slack.getFetchParallelism(), headers.size()));
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, daemonThreads());
        try {
            List<CompletableFuture<RawThread>> futures = headers.stream()
                    .map(header -> CompletableFuture.supplyAsync(() -> toThread(channelId, header, zone), executor))
                    .toList();
            List<RawThread> threads = new ArrayList<>();
            for (CompletableFuture<RawThread> future : futures) {
                threads.add(future.join());
            }
            threads.sort(Comparator.comparing(RawThread::getPostingDate));
            return threads;
        } catch (CompletionException e) {
            if (e.getCause() instanceof FetchException fetchException) {
                throw fetchException;
            }
            throw new FetchException("Failed to fetch Slack threads: " + e.getMessage(), e);
        } finally {
            executor.shutdownNow();
        }
    }

    private List<SlackApiClient.SlackMessage> findHeaders(String channelId, String oldest, String latest) {
        ReportProperties.SlackProperties slack = properties.getSlack();
        Pattern headerPattern = Pattern.compile(slack.getHeaderPattern(), Pattern.CASE_INSENSITIVE);

        List<SlackApiClient.SlackMessage> headers = new ArrayList<>();
        int scanned = 0;
        String cursor = null;
        do {
            int limit = Math.min(slack.getPageSize(), slack.getMaxMessages() - scanned);
            SlackApiClient.HistoryPage page = slackApiClient.history(channelId, oldest, latest, limit, cursor);
            for (SlackApiClient.SlackMessage message : page.getMessages()) {
                scanned++;
                if (isHeader(message, headerPattern)) {
                    headers.add(message);
                }
            }
            cursor = page.isHasMore() ? page.nextCursor() : null;
        } while (cursor != null && !cursor.isBlank() && scanned < slack.getMaxMessages());

        headers.sort(Comparator.comparing(message -> new BigDecimal(message.getTs())));
        return headers;
    }

    private static boolean isHeader(SlackApiClient.SlackMessage message, Pattern headerPattern) {
        if (message.getSubtype() != null && SKIPPED_SUBTYPES.contains(message.getSubtype())) {
            return false;
        }
        // a reply echoed into the channel is not a thread root
        if (message.getThreadTs() != null && !message.getThreadTs().equals(message.getTs())) {
            return false;
        }
        return message.getText() != null && headerPattern.matcher(message.getText()).find();
    }

    private RawThread toThread(String channelId, SlackApiClient.SlackMessage header, ZoneId zone) {
        String headerText = normalize(header.getText());
        LocalDate postedOn = toInstant(header.getTs()).atZone(zone).toLocalDate();
        LocalDate postingDate = headerDateParser.parse(headerText).orElse(postedOn);

        RawThread.RawThreadBuilder thread = RawThread.builder()
                .id(header.getTs())
                .headerText(headerText)
                .postingDate(postingDate)
                .author(authorOf(header));

        String cursor = null;
        do {
            SlackApiClient.HistoryPage page = slackApiClient.replies(channelId, header.getTs(), cursor);
            for (SlackApiClient.SlackMessage message : page.getMessages()) {
                if (header.getTs().equals(message.getTs()) || message.getUser() == null) {
                    continue;
                }
                thread.reply(RawReply.builder()
                        .author(authorOf(message))
                        .text(normalize(message.getText()))
                        .postedAt(toInstant(message.getTs()))
                        .build());
            }
            cursor = page.isHasMore() ? page.nextCursor() : null;
        } while (cursor != null && !cursor.isBlank());

        RawThread result = thread.build();
        log.debug("[Slack] Thread {} ({}): {} replies", result.getId(), postingDate, result.getReplies().size());
        return result;
    }

    private String normalize(String text) {
        return textNormalizer.normalize(text, this::userName);
    }

    private String authorOf(SlackApiClient.SlackMessage message) {
        if (message.getUser() != null) {
            return userName(message.getUser());
        }
        return message.getUsername() != null ? message.getUsername() : "unknown";
    }

    String userName(String userId) {
        String cached = userNames.get(userId);
        if (cached != null) {
            return cached;
        }
        String name = lookupUserName(userId);
        userNames.put(userId, name);
        return name;
    }

    private String lookupUserName(String userId) {
        try {
            SlackApiClient.SlackUser user = slackApiClient.userInfo(userId).getUser();
            if (user == null) {
                return userId;
            }
            if (user.getRealName() != null && !user.getRealName().isBlank()) {
                return user.getRealName();
            }
            if (user.getProfile() != null && user.getProfile().getDisplayName() != null
                    && !user.getProfile().getDisplayName().isBlank()) {
                return user.getProfile().getDisplayName();
            }
            return user.getName() != null ? user.getName() : userId;
        } catch (FetchException e) {
            log.warn("[Slack] Could not resolve user {}: {}", userId, e.getMessage());
            return userId;
        }
    }

    static Instant toInstant(String ts) {
        BigDecimal seconds = new BigDecimal(ts);
        long whole = seconds.longValue();
        long micros = seconds.subtract(BigDecimal.valueOf(whole)).movePointRight(6).longValue();
        return Instant.ofEpochSecond(whole, micros * 1000);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "slack-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
