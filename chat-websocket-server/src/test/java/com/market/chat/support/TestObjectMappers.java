package com.market.chat.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.market.chat.config.JacksonConfig;

public final class TestObjectMappers {

    private TestObjectMappers() {
    }

    public static ObjectMapper create() {
        return new JacksonConfig().objectMapper();
    }
}
