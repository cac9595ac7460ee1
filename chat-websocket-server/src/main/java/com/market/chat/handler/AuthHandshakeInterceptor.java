package com.market.chat.handler;

import com.market.chat.domain.ChatIdentity;
import com.market.chat.exception.UnauthenticatedException;
import com.market.chat.service.TokenAuthenticator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates the WebSocket upgrade. The token comes from the {@code token}
 * query parameter or an {@code Authorization: Bearer} header.
 */
@Component
@Slf4j
public class AuthHandshakeInterceptor implements HandshakeInterceptor {

    public static final String IDENTITY_ATTRIBUTE = "chat.identity";

    private final TokenAuthenticator tokenAuthenticator;

    public AuthHandshakeInterceptor(TokenAuthenticator tokenAuthenticator) {
        this.tokenAuthenticator = tokenAuthenticator;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request);
        try {
            ChatIdentity identity = tokenAuthenticator.authenticate(token);
            attributes.put(IDENTITY_ATTRIBUTE, identity);
            return true;
        } catch (UnauthenticatedException e) {
            log.warn("WebSocket handshake rejected from {}: {}", request.getRemoteAddress(), e.getMessage());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        // nothing to do
    }

    static String extractToken(ServerHttpRequest request) {
        String fromQuery = UriComponentsBuilder.fromUri(request.getURI())
            .build()
            .getQueryParams()
            .getFirst("token");
        if (fromQuery != null && !fromQuery.isBlank()) {
            return fromQuery;
        }
        return request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
    }
}
