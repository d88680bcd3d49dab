package com.serge.appointments.config.logging;

import io.micrometer.common.util.StringUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * One access-log line per request. The request id from {@code X-Request-Id} (generated when
 * missing) is put in the MDC for every log line of the request and echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class HttpLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(HttpLoggingFilter.class);
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    private static final int MAX_LOG_BYTES = 2048;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = Optional.ofNullable(request.getHeader(REQUEST_ID_HEADER))
                .filter(StringUtils::isNotBlank)
                .orElseGet(() -> UUID.randomUUID().toString());
        MDC.put(MDC_REQUEST_ID, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        ContentCachingRequestWrapper req = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper resp = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(req, resp);
        } finally {
            try {
                String user = request.getUserPrincipal() != null ? request.getUserPrincipal().getName() : "-";
                String idem = Optional.ofNullable(request.getHeader("Idempotency-Key")).orElse("-");
                log.info("http_request method={} path={} query={} status={} duration_ms={} user={} idem_key={} request_id={}",
                        req.getMethod(),
                        req.getRequestURI(),
                        req.getQueryString() == null ? "-" : req.getQueryString(),
                        resp.getStatus(),
                        System.currentTimeMillis() - start,
                        user,
                        idem,
                        requestId);
                if (log.isDebugEnabled() && isJson(req.getContentType())) {
                    String body = abbreviate(req.getContentAsByteArray());
                    if (!body.isEmpty()) log.debug("http.request.body {}", body);
                }
                resp.copyBodyToResponse();
            } finally {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }

    private static boolean isJson(String contentType) {
        if (StringUtils.isBlank(contentType)) return false;
        try {
            return MediaType.APPLICATION_JSON.includes(MediaType.parseMediaType(contentType));
        } catch (Exception e) {
            log.debug("http.content_type_unparseable value={}", contentType);
            return false;
        }
    }

    private static String abbreviate(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";
        int len = Math.min(bytes.length, MAX_LOG_BYTES);
        String s = new String(bytes, 0, len, StandardCharsets.UTF_8).replaceAll("\\s+", " ").trim();
        return bytes.length > MAX_LOG_BYTES ? s + "...(truncated)" : s;
    }
}
