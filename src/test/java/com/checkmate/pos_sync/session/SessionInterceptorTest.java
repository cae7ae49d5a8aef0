package com.checkmate.pos_sync.session;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.method.HandlerMethod;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionInterceptorTest {

    @Mock
    private SessionService sessionService;

    @InjectMocks
    private SessionInterceptor interceptor;

    @Test
    @DisplayName("Resolved session is handed to the handler as a request attribute")
    void storesSession() {
        StationSession session = new StationSession(20L, 3L, 42L, "cashier1", null,
                Abilities.of(List.of("line:L1")), SessionStatus.ACTIVE, Instant.now(), Instant.now(), null);
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pos/transactions");
        request.addHeader("Authorization", "Bearer abc");
        when(sessionService.requireSession("Bearer abc")).thenReturn(session);

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), mock(HandlerMethod.class)));
        assertSame(session, request.getAttribute(SessionInterceptor.SESSION_ATTRIBUTE));
    }

    @Test
    @DisplayName("Missing token fails before the handler runs")
    void rejectsMissingToken() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/pos/transactions");
        when(sessionService.requireSession(null)).thenThrow(new UnauthenticatedException());

        assertThrows(UnauthenticatedException.class,
                () -> interceptor.preHandle(request, new MockHttpServletResponse(), mock(HandlerMethod.class)));
        assertNull(request.getAttribute(SessionInterceptor.SESSION_ATTRIBUTE));
    }

    @Test
    @DisplayName("Requests not served by a controller method pass through")
    void ignoresOtherHandlers() {
        MockHttpServletRequest request = new MockHttpServletRequest("OPTIONS", "/api/pos/transactions");

        assertTrue(interceptor.preHandle(request, new MockHttpServletResponse(), new Object()));
        verifyNoInteractions(sessionService);
    }
}
