package com.slb.crowdfund_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Accepts a caller supplied {@code X-Trace-Id} (or mints one) and echoes it on the response.
 */
@Component
public class TraceIdFilter extends OncePerRequestFilter {

    private static final int MAX_TRACE_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = sanitize(request.getHeader(TraceIdHolder.TRACE_ID_HEADER));

        TraceIdHolder.set(traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceIdHolder.clear();
        }
    }

    // 上游传入的 traceId 只保留可打印字符并截断，避免日志注入
    static String sanitize(String supplied) {
        if (!StringUtils.hasText(supplied)) {
            return TraceIdHolder.generate();
        }
        String cleaned = supplied.trim().replaceAll("[^A-Za-z0-9_.-]", "");
        if (cleaned.isEmpty()) {
            return TraceIdHolder.generate();
        }
        return cleaned.length() > MAX_TRACE_ID_LENGTH ? cleaned.substring(0, MAX_TRACE_ID_LENGTH) : cleaned;
    }
}
