package com.market.chat.exception;

/**
 * Codec failure: oversized input, malformed ciphertext, failed authentication
 * or failed decompression of a value marked compressed.
 */
public class EncodingException extends ChatException {

    public EncodingException(String message) {
        super(message, ChatErrorCode.ENCODING_FAILED);
    }

    public EncodingException(String message, Throwable cause) {
        super(message, cause, ChatErrorCode.ENCODING_FAILED);
    }
}
