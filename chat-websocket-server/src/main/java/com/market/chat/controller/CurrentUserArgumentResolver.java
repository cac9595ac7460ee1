package com.market.chat.controller;

import com.market.chat.domain.ChatIdentity;
import com.market.chat.service.TokenAuthenticator;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentUser} parameters from the {@code Authorization: Bearer} header.
 * A missing or invalid token fails the request with 401.
 */
@Component
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final TokenAuthenticator tokenAuthenticator;

    public CurrentUserArgumentResolver(TokenAuthenticator tokenAuthenticator) {
        this.tokenAuthenticator = tokenAuthenticator;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
            && ChatIdentity.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public ChatIdentity resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                        NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        return tokenAuthenticator.authenticate(webRequest.getHeader(HttpHeaders.AUTHORIZATION));
    }
}
