package com.market.chat.service;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes inbound message text before it is encoded.
 */
@Component
public class MessageSanitizer {

    // Control characters other than \t, \n and \r
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r\\n?");
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{4,}");

    public String sanitize(String content) {
        if (content == null) {
            return "";
        }
        String sanitized = content.trim();
        sanitized = CONTROL_CHARS.matcher(sanitized).replaceAll("");
        sanitized = LINE_BREAKS.matcher(sanitized).replaceAll("\n");
        sanitized = EXCESS_NEWLINES.matcher(sanitized).replaceAll("\n\n\n");
        return sanitized;
    }
}
