package com.innstay.booking.security;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds an {@link ActorContext} from the identity headers set by the gateway.
 * Staff roles are only honoured together with a user id.
 */
@Slf4j
@Component
public class ActorContextArgumentResolver implements HandlerMethodArgumentResolver {

    static final String HEADER_USER_ID = "X-User-Id";
    static final String HEADER_USER_EMAIL = "X-User-Email";
    static final String HEADER_USER_ROLE = "X-User-Role";
    static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    static final String HEADER_REAL_IP = "X-Real-IP";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ActorContext.class.equals(parameter.getParameterType());
    }

    @Override
    public ActorContext resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                        NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String clientIp = request != null ? extractClientIp(request) : "unknown";

        Long userId = parseUserId(webRequest.getHeader(HEADER_USER_ID));
        if (userId == null) {
            return ActorContext.anonymous(clientIp);
        }
        ActorRole role = ActorRole.fromHeader(webRequest.getHeader(HEADER_USER_ROLE));
        return new ActorContext(userId, webRequest.getHeader(HEADER_USER_EMAIL), role, clientIp);
    }

    public static String extractClientIp(HttpServletRequest request) {
        String xff = request.getHeader(HEADER_FORWARDED_FOR);
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String realIp = request.getHeader(HEADER_REAL_IP);
        if (realIp != null && !realIp.isBlank()) {
            return realIp.trim();
        }
        String remoteAddr = request.getRemoteAddr();
        return remoteAddr != null ? remoteAddr : "unknown";
    }

    private static Long parseUserId(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed {} header: {}", HEADER_USER_ID, value);
            return null;
        }
    }
}
