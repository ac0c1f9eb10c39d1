package me.golemcore.report.adapter.outbound.mail;

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

import java.util.Locale;

/**
 * Connection security modes for SMTP delivery.
 */
public enum MailSecurity {

    /** Implicit SSL/TLS on a dedicated port, usually 465. */
    SSL,

    /** STARTTLS upgrade on the submission port, usually 587. */
    STARTTLS,

    /** No encryption (not recommended). */
    NONE;

    /**
     * Parses a security mode (case-insensitive). Blank means STARTTLS, which
     * all the preset providers use.
     *
     * @throws IllegalArgumentException
     *             if the value is not recognized
     */
    public static MailSecurity fromString(String value) {
        if (value == null || value.isBlank()) {
            return STARTTLS;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
