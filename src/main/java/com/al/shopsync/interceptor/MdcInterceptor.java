package com.al.shopsync.interceptor;

import org.slf4j.MDC;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.UUID;

/**
 * Tags every request with a request id, taken from the {@code X-Request-Id}
 * header or generated, and echoes it back.
 */
@Component
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "requestId";
    public static final String HEADER_KEY = "X-Request-Id";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String requestId = request.getHeader(HEADER_KEY);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        MDC.put(MDC_KEY, requestId);
        response.setHeader(HEADER_KEY, requestId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        MDC.remove(MDC_KEY);
    }
}
