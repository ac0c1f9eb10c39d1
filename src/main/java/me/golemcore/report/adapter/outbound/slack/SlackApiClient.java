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

import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.FetchException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thin client for the Slack Web API methods the report needs:
 * {@code conversations.history}, {@code conversations.replies} and
 * {@code users.info}.
 *
 * <p>
 * Every call is a GET with the bot token as bearer. HTTP errors and
 * {@code "ok": false} answers become {@link FetchException}; HTTP 429 is
 * retried after the {@code Retry-After} delay.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SlackApiClient {

    private static final int MAX_ATTEMPTS = 3;
    private static final long MAX_RETRY_DELAY_SECONDS = 30;
    private static final Set<String> AUTH_ERRORS = Set.of(
            "not_authed", "invalid_auth", "token_revoked", "token_expired", "account_inactive", "missing_scope");

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final ReportProperties properties;

    /**
     * Read one page of channel history between two epoch timestamps.
     */
    public HistoryPage history(String channel, String oldest, String latest, int limit, String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("oldest", oldest);
        params.put("latest", latest);
        params.put("inclusive", "true");
        params.put("limit", String.valueOf(limit));
        if (cursor != null && !cursor.isBlank()) {
            params.put("cursor", cursor);
        }
        return call("conversations.history", params, HistoryPage.class);
    }

    /**
     * Read one page of a thread, the parent message included.
     */
    public HistoryPage replies(String channel, String threadTs, String cursor) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("channel", channel);
        params.put("ts", threadTs);
        params.put("limit", String.valueOf(properties.getSlack().getPageSize()));
        if (cursor != null && !cursor.isBlank()) {
            params.put("cursor", cursor);
        }
        return call("conversations.replies", params, HistoryPage.class);
    }

    public UserInfo userInfo(String userId) {
        return call("users.info", Map.of("user", userId), UserInfo.class);
    }

    <T extends SlackResponse> T call(String method, Map<String, String> params, Class<T> type) {
        ReportProperties.SlackProperties slack = properties.getSlack();
        if (slack.getBotToken() == null || slack.getBotToken().isBlank()) {
            throw new FetchException("Slack bot token is not configured (report.slack.bot-token)");
        }

        HttpUrl base = HttpUrl.parse(stripTrailingSlash(slack.getBaseUrl()) + "/" + method);
        if (base == null) {
            throw new FetchException("Invalid Slack base URL: " + slack.getBaseUrl());
        }
        HttpUrl.Builder url = base.newBuilder();
        params.forEach(url::addQueryParameter);

        Request request = new Request.Builder()
                .url(url.build())
                .header("Authorization", "Bearer " + slack.getBotToken())
                .get()
                .build();

        for (int attempt = 1;; attempt++) {
            try (Response response = okHttpClient.newCall(request).execute()) {
                if (response.code() == 429 && attempt < MAX_ATTEMPTS) {
                    long delay = retryAfterSeconds(response.header("Retry-After"));
                    log.info("[Slack] {} rate limited, retrying in {}s (attempt {}/{})", method, delay, attempt,
                            MAX_ATTEMPTS);
                    sleep(delay);
                    continue;
                }
                ResponseBody body = response.body();
                if (!response.isSuccessful()) {
                    throw new FetchException("Slack " + method + " failed: HTTP " + response.code());
                }
                if (body == null) {
                    throw new FetchException("Slack " + method + " returned an empty body");
                }
                T parsed = objectMapper.readValue(body.string(), type);
                if (!parsed.isOk()) {
                    throw toFetchException(method, params.get("channel"), parsed.getError());
                }
                return parsed;
            } catch (IOException e) {
                throw new FetchException("Slack " + method + " request failed: " + e.getMessage(), e);
            }
        }
    }

    private static FetchException toFetchException(String method, String channel, String error) {
        if ("channel_not_found".equals(error)) {
            return new FetchException("Slack channel not found: " + channel);
        }
        if (AUTH_ERRORS.contains(error)) {
            return new FetchException("Slack authentication failed: " + error);
        }
        return new FetchException("Slack " + method + " error: " + error);
    }

    private static long retryAfterSeconds(String header) {
        if (header == null) {
            return 1;
        }
        try {
            return Math.min(Math.max(Long.parseLong(header.trim()), 1), MAX_RETRY_DELAY_SECONDS);
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    private static void sleep(long seconds) {
        try {
            Thread.sleep(seconds * 1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted while waiting for Slack rate limit", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackResponse {
        private boolean ok;
        private String error;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistoryPage extends SlackResponse {
        private List<SlackMessage> messages = new ArrayList<>();
        @JsonProperty("has_more")
        private boolean hasMore;
        @JsonProperty("response_metadata")
        private ResponseMetadata responseMetadata;

        public String nextCursor() {
            return responseMetadata != null ? responseMetadata.getNextCursor() : null;
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseMetadata {
        @JsonProperty("next_cursor")
        private String nextCursor;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackMessage {
        private String ts;
        @JsonProperty("thread_ts")
        private String threadTs;
        private String user;
        private String username;
        @JsonProperty("bot_id")
        private String botId;
        private String subtype;
        private String text;
    }

    @Data
    @EqualsAndHashCode(callSuper = true)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UserInfo extends SlackResponse {
        private SlackUser user;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SlackUser {
        private String id;
        private String name;
        @JsonProperty("real_name")
        private String realName;
        private Profile profile;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Profile {
        @JsonProperty("display_name")
        private String displayName;
        @JsonProperty("real_name")
        private String realName;
    }
}
