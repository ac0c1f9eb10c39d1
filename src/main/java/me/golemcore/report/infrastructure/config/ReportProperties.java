package me.golemcore.report.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties for the report generator, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code report.*} prefix:
 * <ul>
 * <li>{@link SlackProperties} - channel to read daily report threads from</li>
 * <li>{@link ParsingProperties} - thresholds of the message parser</li>
 * <li>{@link EnhancementProperties} - optional AI polishing of the draft</li>
 * <li>{@link LetterProperties} - greeting and sign-off around the report
 * body</li>
 * <li>{@link StorageProperties} - where report files are written</li>
 * <li>{@link MailProperties} - SMTP delivery and recipients</li>
 * <li>{@link HttpProperties} - shared OkHttp client settings</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "report")
@Data
public class ReportProperties {

    private SlackProperties slack = new SlackProperties();
    private ParsingProperties parsing = new ParsingProperties();
    private EnhancementProperties enhancement = new EnhancementProperties();
    private LetterProperties letter = new LetterProperties();
    private StorageProperties storage = new StorageProperties();
    private MailProperties mail = new MailProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class SlackProperties {
        private String botToken = "";
        private String channelId = "";
        private String baseUrl = "https://slack.com/api";
        private String headerPattern = "daily\\s*report|status\\s*update|standup|stand-up";
        private String zoneId = "UTC";
        private int pageSize = 200;
        private int maxMessages = 1000;
        private int fetchParallelism = 4;
    }

    @Data
    public static class ParsingProperties {
        private int minItemLength = 5;
        private int notesMinLength = 40;
        private boolean authorAsDefaultAssignee = false;
    }

    @Data
    public static class EnhancementProperties {
        private String provider = "none";
        private String model = "groq/llama-3.3-70b-versatile";
        private double temperature = 0.2;
        private int maxTokens = 4000;
        private int timeoutSeconds = 60;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class LetterProperties {
        private boolean enabled = true;
        private String senderName = "Report Generator";
        private String senderEmail = "";
    }

    @Data
    public static class StorageProperties {
        private String outputDir = "${user.home}/.golemcore/reports";
    }

    @Data
    public static class MailProperties {
        private boolean enabled = false;
        private String provider = "gmail";
        private String host = "";
        private int port = 587;
        private String username = "";
        private String password = "";
        private String security = "starttls";
        private int connectTimeout = 10000;
        private int readTimeout = 30000;
        private String subjectPrefix = "End of Week Update";
        private List<String> recipientsTo = new ArrayList<>();
        private List<String> recipientsCc = new ArrayList<>();
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
