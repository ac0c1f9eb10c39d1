package me.golemcore.report.domain.service;

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
import me.golemcore.report.port.outbound.EnhancementPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Optional AI polishing of a draft report.
 *
 * <p>
 * Never fails: when the provider is unavailable, errors out, exceeds
 * {@code report.enhancement.timeout-seconds} or answers with blank text, the
 * draft is returned unchanged with {@code enhanced=false}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportEnhancementService {

    private final EnhancementPort enhancementPort;
    private final ReportProperties properties;

    public EnhancementOutcome enhance(String draft) {
        if (!enhancementPort.isAvailable()) {
            log.warn("[AI] Enhancement provider not available, using draft report");
            return EnhancementOutcome.draft(draft);
        }

        int timeoutSeconds = properties.getEnhancement().getTimeoutSeconds();
        try {
            String enhanced = enhancementPort.enhance(draft).get(timeoutSeconds, TimeUnit.SECONDS);
            if (enhanced == null || enhanced.isBlank()) {
                log.warn("[AI] Enhancement returned empty text, using draft report");
                return EnhancementOutcome.draft(draft);
            }
            log.info("[AI] Report enhanced ({} chars)", enhanced.length());
            return new EnhancementOutcome(enhanced, true);
        } catch (TimeoutException e) {
            log.warn("[AI] Enhancement timed out after {}s, using draft report", timeoutSeconds);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[AI] Enhancement failed, using draft report: {}", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[AI] Enhancement interrupted, using draft report");
        } catch (RuntimeException e) {
            log.warn("[AI] Enhancement failed, using draft report: {}", e.getMessage());
        }
        return EnhancementOutcome.draft(draft);
    }

    /**
     * Final report text and whether it came from the AI provider.
     */
    public record EnhancementOutcome(String text, boolean enhanced) {

        static EnhancementOutcome draft(String draft) {
            return new EnhancementOutcome(draft, false);
        }
    }
}
