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

import me.golemcore.report.domain.model.ReportEmail;
import me.golemcore.report.infrastructure.config.ReportProperties;
import me.golemcore.report.port.outbound.ReportMailException;
import me.golemcore.report.port.outbound.ReportMailPort;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeBodyPart;
import jakarta.mail.internet.MimeMessage;
import jakarta.mail.internet.MimeMultipart;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.util.Date;
import java.util.List;

/**
 * Delivers reports over SMTP with Jakarta Mail.
 *
 * <p>
 * The message is {@code multipart/alternative}: the plain report text plus an
 * HTML rendering. Host, port and security come from the provider preset
 * ({@code gmail}, {@code outlook}, {@code yahoo}) or, for {@code custom}, from
 * {@code report.mail.*}. Credentials never appear in error messages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SmtpReportMailer implements ReportMailPort {

    private final ReportProperties properties;
    private final ReportHtmlRenderer htmlRenderer;

    @Override
    public boolean isConfigured() {
        ReportProperties.MailProperties mail = properties.getMail();
        if (!mail.isEnabled()) {
            return false;
        }
        String host = resolve(mail).host();
        return host != null && !host.isBlank();
    }

    @Override
    public void send(ReportEmail email) {
        ReportProperties.MailProperties mail = properties.getMail();
        SmtpTarget target = resolve(mail);
        try {
            Session session = MailSessionFactory.createSmtpSession(
                    target.host(), target.port(),
                    mail.getUsername(), mail.getPassword(),
                    target.security(),
                    mail.getConnectTimeout(), mail.getReadTimeout());

            MimeMessage message = buildMessage(session, email);
            deliver(message);
            log.info("[SMTP] Report sent via {}:{} to {}", target.host(), target.port(), email.getTo());
        } catch (MessagingException | UnsupportedEncodingException e) {
            String error = sanitizeError(e.getMessage());
            log.warn("[SMTP] Failed to send report: {}", error);
            throw new ReportMailException("SMTP error: " + error, e);
        }
    }

    MimeMessage buildMessage(Session session, ReportEmail email)
            throws MessagingException, UnsupportedEncodingException {
        ReportProperties.LetterProperties letter = properties.getLetter();
        String fromAddress = letter.getSenderEmail() != null && !letter.getSenderEmail().isBlank()
                ? letter.getSenderEmail()
                : properties.getMail().getUsername();

        MimeMessage message = new MimeMessage(session);
        message.setFrom(new InternetAddress(fromAddress, letter.getSenderName(), "UTF-8"));
        message.setRecipients(Message.RecipientType.TO, parseAddresses(email.getTo()));
        if (email.getCc() != null && !email.getCc().isEmpty()) {
            message.setRecipients(Message.RecipientType.CC, parseAddresses(email.getCc()));
        }
        message.setSubject(email.getSubject(), "UTF-8");

        MimeBodyPart textPart = new MimeBodyPart();
        textPart.setText(email.getBody(), "UTF-8", "plain");
        MimeBodyPart htmlPart = new MimeBodyPart();
        htmlPart.setText(htmlRenderer.render(email.getBody()), "UTF-8", "html");

        MimeMultipart content = new MimeMultipart("alternative");
        content.addBodyPart(textPart);
        content.addBodyPart(htmlPart);
        message.setContent(content);
        message.setSentDate(new Date());
        message.saveChanges();
        return message;
    }

    private static InternetAddress[] parseAddresses(List<String> addresses) throws MessagingException {
        return InternetAddress.parse(String.join(",", addresses), true);
    }

    SmtpTarget resolve(ReportProperties.MailProperties mail) {
        SmtpProviderPreset preset = SmtpProviderPreset.fromString(mail.getProvider());
        if (preset == SmtpProviderPreset.CUSTOM) {
            return new SmtpTarget(mail.getHost(), mail.getPort(), MailSecurity.fromString(mail.getSecurity()));
        }
        return new SmtpTarget(preset.getHost(), preset.getPort(), preset.getSecurity());
    }

    String sanitizeError(String message) {
        if (message == null) {
            return "Unknown error";
        }
        ReportProperties.MailProperties mail = properties.getMail();
        String sanitized = message;
        if (mail.getUsername() != null && !mail.getUsername().isBlank()) {
            sanitized = sanitized.replace(mail.getUsername(), "***");
        }
        if (mail.getPassword() != null && !mail.getPassword().isBlank()) {
            sanitized = sanitized.replace(mail.getPassword(), "***");
        }
        return sanitized;
    }

    protected void deliver(MimeMessage message) throws MessagingException {
        Transport.send(message);
    }

    record SmtpTarget(String host, int port, MailSecurity security) {
    }
}
