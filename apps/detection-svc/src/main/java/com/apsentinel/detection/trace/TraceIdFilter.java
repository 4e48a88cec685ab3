package com.apsentinel.detection.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates {@value #TRACE_HEADER} into the request context, the MDC and the response.
 * A missing header, or one that is too long or carries characters outside
 * {@code [A-Za-z0-9._-]}, is replaced by a fresh UUID so client input never reaches log lines
 * verbatim.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    static final int MAX_TRACE_ID_LENGTH = 64;

    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        RequestContextHolder.set(RequestContextHolder.RequestContext.builder()
                .traceId(traceId)
                .build());
        MDC.put(RequestContextHolder.MDC_TRACE_ID, traceId);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextHolder.MDC_TRACE_ID);
            MDC.remove(RequestContextHolder.MDC_TENANT_ID);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String header) {
        if (header == null) {
            return UUID.randomUUID().toString();
        }
        String candidate = header.trim();
        if (candidate.isEmpty()
                || candidate.length() > MAX_TRACE_ID_LENGTH
                || !SAFE_TRACE_ID.matcher(candidate).matches()) {
            return UUID.randomUUID().toString();
        }
        return candidate;
    }
}
