package com.shopflow.common.tracing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("들어온 X-Correlation-Id를 MDC와 응답 헤더에 그대로 싣는다")
    void propagatesIncomingId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stock/P1");
        request.addHeader(CorrelationIds.HEADER, "corr-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        // When
        filter.doFilter(request, response, (req, res) -> seen.set(MDC.get(CorrelationIds.MDC_KEY)));

        // Then
        assertThat(seen.get()).isEqualTo("corr-123");
        assertThat(response.getHeader(CorrelationIds.HEADER)).isEqualTo("corr-123");
        assertThat(MDC.get(CorrelationIds.MDC_KEY)).isNull();
    }

    @Test
    @DisplayName("헤더가 없으면 새 ID를 만든다")
    void generatesIdWhenMissing() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, (req, res) -> { });

        assertThat(response.getHeader(CorrelationIds.HEADER)).isNotBlank();
    }

    @Test
    @DisplayName("MdcTaskDecorator는 작업 스레드에 MDC를 복사하고 원래 상태로 되돌린다")
    void taskDecorator_CopiesContext() throws Exception {
        MDC.put(CorrelationIds.MDC_KEY, "corr-9");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable decorated;
        try {
            decorated = new MdcTaskDecorator().decorate(() -> seen.set(MDC.get(CorrelationIds.MDC_KEY)));
        } finally {
            MDC.clear();
        }

        Thread worker = new Thread(decorated);
        worker.start();
        worker.join();

        assertThat(seen.get()).isEqualTo("corr-9");
    }
}
