package com.market.chat.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ChatRole {
    CUSTOMER,
    VENDOR,
    ADMIN;

    /**
     * The role on the other side of a conversation. Only defined for participant roles.
     */
    public ChatRole counterpart() {
        switch (this) {
            case CUSTOMER:
                return VENDOR;
            case VENDOR:
                return CUSTOMER;
            default:
                throw new IllegalStateException("No counterpart for role " + this);
        }
    }

    public boolean isParticipantRole() {
        return this == CUSTOMER || this == VENDOR;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ChatRole> fromClaim(String claim) {
        if (claim == null) {
            return Optional.empty();
        }
        for (ChatRole role : values()) {
            if (role.wireName().equalsIgnoreCase(claim.trim())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
