package com.checkmate.pos_sync.session;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Resolves the bearer session before the handler's arguments are bound, so an
 * anonymous request is answered with 401 whatever its body looks like.
 *
 * Handlers read the session from the {@link #SESSION_ATTRIBUTE} request attribute.
 */
@Component
@RequiredArgsConstructor
public class SessionInterceptor implements HandlerInterceptor {

    public static final String SESSION_ATTRIBUTE = "pos.stationSession";

    private final SessionService sessionService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        StationSession session = sessionService.requireSession(request.getHeader(HttpHeaders.AUTHORIZATION));
        request.setAttribute(SESSION_ATTRIBUTE, session);
        return true;
    }
}
