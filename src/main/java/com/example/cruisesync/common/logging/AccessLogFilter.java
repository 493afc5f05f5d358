package com.example.cruisesync.common.logging;

import java.io.IOException;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Request id and client ip in the MDC plus one ACCESS line per request. Health checks only log
 * at debug; webhook deliveries answering slower than {@link #SLOW_WEBHOOK_MS} are flagged since
 * the vendor treats a slow answer as a failed delivery.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_CLIENT_IP = "clientIp";

    static final long SLOW_WEBHOOK_MS = 2000L;
    private static final String WEBHOOK_PREFIX = "/api/v1/webhooks/";
    private static final String PROBE_PREFIX = "/actuator/";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = resolveRequestId(request);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        String clientIp = resolveClientIp(request);

        MDC.put(MDC_REQUEST_ID, requestId);
        MDC.put(MDC_CLIENT_IP, clientIp);
        try {
            filterChain.doFilter(request, response);
        } finally {
            logRequest(request, response.getStatus(), System.currentTimeMillis() - start, clientIp);
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_CLIENT_IP);
        }
    }

    private void logRequest(HttpServletRequest request, int status, long costMs, String clientIp) {
        String uri = request.getRequestURI();
        if (uri.startsWith(PROBE_PREFIX)) {
            log.debug("ACCESS method={} uri={} status={} costMs={}", request.getMethod(), uri, status, costMs);
            return;
        }
        if (uri.startsWith(WEBHOOK_PREFIX) && costMs >= SLOW_WEBHOOK_MS) {
            log.warn("ACCESS_SLOW_WEBHOOK uri={} status={} costMs={} ip={}", uri, status, costMs, clientIp);
            return;
        }
        log.info("ACCESS method={} uri={} status={} costMs={} ip={}",
                request.getMethod(), uri, status, costMs, clientIp);
    }

    private String resolveRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(HEADER_REQUEST_ID);
        if (requestId == null || requestId.trim().isEmpty()) {
            return UUID.randomUUID().toString().replace("-", "");
        }
        return requestId.trim();
    }

    private String resolveClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor == null || xForwardedFor.trim().isEmpty()) {
            return request.getRemoteAddr();
        }
        int commaIndex = xForwardedFor.indexOf(',');
        return (commaIndex > 0 ? xForwardedFor.substring(0, commaIndex) : xForwardedFor).trim();
    }
}
