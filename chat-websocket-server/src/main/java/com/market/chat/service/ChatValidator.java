package com.market.chat.service;

import com.market.chat.domain.ValidationResult;
import com.market.chat.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Identifier and content rules shared by both transports.
 */
@Component
public class ChatValidator {

    public static final int MAX_CONTENT_LENGTH = 5_000;
    public static final int SUSPICIOUS_CONTENT_LENGTH = 10_000;
    public static final String TEMP_MESSAGE_PREFIX = "temp-";

    private static final Pattern UUID_PATTERN = Pattern.compile(
        "^(?:[0-9a-f]{8}-[0-9a-f]{4}-[1-8][0-9a-f]{3}-[89ab][0-9a-f]{3}-[0-9a-f]{12}"
            + "|00000000-0000-0000-0000-000000000000"
            + "|ffffffff-ffff-ffff-ffff-ffffffffffff)$",
        Pattern.CASE_INSENSITIVE);

    public boolean isUuid(String value) {
        return value != null && UUID_PATTERN.matcher(value).matches();
    }

    public ValidationResult validateConversationId(String conversationId) {
        if (conversationId == null || conversationId.isEmpty()) {
            return ValidationResult.failure("Conversation ID is required");
        }
        if (!isUuid(conversationId)) {
            return ValidationResult.failure("Invalid conversation ID format");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateVendorId(String vendorId) {
        if (vendorId == null || vendorId.isEmpty()) {
            return ValidationResult.failure("Vendor ID is required");
        }
        if (!isUuid(vendorId)) {
            return ValidationResult.failure("Invalid vendor ID format");
        }
        return ValidationResult.success();
    }

    /**
     * Client placeholders ({@code temp-...}) pass; callers treat them as no-ops.
     */
    public ValidationResult validateMessageId(String messageId) {
        if (messageId == null || messageId.isEmpty()) {
            return ValidationResult.failure("Message ID is required");
        }
        if (!isUuid(messageId) && !messageId.startsWith(TEMP_MESSAGE_PREFIX)) {
            return ValidationResult.failure("Invalid message ID format");
        }
        return ValidationResult.success();
    }

    public ValidationResult validateContent(String content) {
        if (content == null) {
            return ValidationResult.failure("Message content is required");
        }
        if (content.length() > SUSPICIOUS_CONTENT_LENGTH) {
            return ValidationResult.failure("Message content is suspiciously long");
        }
        String trimmed = content.trim();
        if (trimmed.isEmpty()) {
            return ValidationResult.failure("Message content cannot be empty");
        }
        if (trimmed.length() > MAX_CONTENT_LENGTH) {
            return ValidationResult.failure("Message is too long (max " + MAX_CONTENT_LENGTH + " characters)");
        }
        return ValidationResult.success();
    }

    /**
     * Throw {@link ValidationException} with the result's message when it is invalid.
     */
    public void require(ValidationResult result) {
        if (!result.isValid()) {
            throw new ValidationException(result.getErrorMessage());
        }
    }
}
