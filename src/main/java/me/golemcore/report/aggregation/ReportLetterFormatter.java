package me.golemcore.report.aggregation;

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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Wraps a report body in the End of Week Update e-mail text: greeting, the
 * covered period, the body and the sign-off with the sender name.
 */
@Component
@RequiredArgsConstructor
public class ReportLetterFormatter {

    private final ReportProperties properties;

    public String wrap(String body, String dateRangeLabel) {
        ReportProperties.LetterProperties letter = properties.getLetter();
        if (!letter.isEnabled()) {
            return body;
        }
        return "Hi all,\n\n"
                + "Hope you are doing well!\n\n"
                + "Please find below the End of Week Update covering the period from " + dateRangeLabel + ":\n\n"
                + body.stripTrailing() + "\n\n"
                + "Please let us know if you have any questions or concerns.\n\n"
                + "Thanks and Best regards,\n"
                + letter.getSenderName() + "\n";
    }
}
