package com.slb.crowdfund_backend.common.trace;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-local holder for per-request trace identifiers, mirrored into the SLF4J MDC
 * under {@link #MDC_KEY} so every log line of a request carries it.
 */
public final class TraceIdHolder {
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    public static Optional<String> getOptional() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    /**
     * 非 HTTP 线程（定时任务等）没有上游 traceId 时就地生成一个。
     */
    public static String require() {
        return getOptional().orElseGet(() -> {
            String generated = generate();
            set(generated);
            return generated;
        });
    }

    public static String generate() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }
}
