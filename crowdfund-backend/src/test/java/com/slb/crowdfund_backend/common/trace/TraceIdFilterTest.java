package com.slb.crowdfund_backend.common.trace;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class TraceIdFilterTest {

    @Test
    void sanitizeShouldStripUnsafeCharactersAndTruncate() {
        assertThat(TraceIdFilter.sanitize("abc-123\n<script>")).isEqualTo("abc-123script");
        assertThat(TraceIdFilter.sanitize("x".repeat(100))).hasSize(64);
        assertThat(TraceIdFilter.sanitize("   ")).hasSize(32);
        assertThat(TraceIdFilter.sanitize("$$$")).hasSize(32);
    }

    @Test
    void filterShouldExposeTraceIdDuringRequestAndClearAfter() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(TraceIdHolder.TRACE_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        FilterChain chain = (req, res) -> seen.set(TraceIdHolder.require());

        new TraceIdFilter().doFilter(request, response, chain);

        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(response.getHeader(TraceIdHolder.TRACE_ID_HEADER)).isEqualTo("req-42");
        assertThat(TraceIdHolder.getOptional()).isEmpty();
    }
}
