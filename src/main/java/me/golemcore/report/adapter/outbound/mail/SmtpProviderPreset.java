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
 * Known SMTP providers. {@link #CUSTOM} takes host, port and security from
 * {@code report.mail.*}.
 */
public enum SmtpProviderPreset {

    GMAIL("smtp.gmail.com", 587, MailSecurity.STARTTLS),
    OUTLOOK("smtp.office365.com", 587, MailSecurity.STARTTLS),
    YAHOO("smtp.mail.yahoo.com", 587, MailSecurity.STARTTLS),
    CUSTOM(null, 0, null);

    private final String host;
    private final int port;
    private final MailSecurity security;

    SmtpProviderPreset(String host, int port, MailSecurity security) {
        this.host = host;
        this.port = port;
        this.security = security;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public MailSecurity getSecurity() {
        return security;
    }

    public static SmtpProviderPreset fromString(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown SMTP provider: " + value
                    + ". Use one of: gmail, outlook, yahoo, custom", e);
        }
    }
}
