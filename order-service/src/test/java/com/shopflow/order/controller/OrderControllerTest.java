package com.shopflow.order.controller;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.order.dto.CancelResult;
import com.shopflow.order.dto.CaptureResult;
import com.shopflow.order.dto.CheckoutResult;
import com.shopflow.order.dto.CodOrderResult;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.saga.CheckoutCommand;
import com.shopflow.order.saga.OrderSagaOrchestrator;
import com.shopflow.order.saga.SagaStep;
import com.shopflow.order.saga.SagaStepException;
import com.shopflow.order.service.OrderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(OrderController.class)
class OrderControllerTest {

    private static final String CHECKOUT_BODY = """
            {"userId":"user-1","shippingMode":"express",
             "address":{"zipCode":"560001","city":"Bengaluru","state":"KA"},
             "itemShippingModes":{"P2":"standard"}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private OrderSagaOrchestrator orchestrator;

    @MockBean
    private OrderService orderService;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @SuppressWarnings("unchecked")
    private final ValueOperations<String, String> valueOps = mock(ValueOperations.class);

    @BeforeEach
    void setUp() {
        given(redisTemplate.opsForValue()).willReturn(valueOps);
    }

    @Test
    @DisplayName("체크아웃 성공 - 201, 승인 URL 반환, 멱등 키 값을 주문 ID로 바꾼다")
    void createOrder_Created() throws Exception {
        // Given
        given(valueOps.setIfAbsent(eq("idempotency:order:key-1"), eq("processing"), any(Duration.class)))
                .willReturn(true);
        given(orchestrator.createOrder(any(CheckoutCommand.class))).willReturn(new CheckoutResult(
                "order-1", "PAYPAL-1", "https://paypal.test/approve/PAYPAL-1", new BigDecimal("1040.00")));

        // When & Then
        mockMvc.perform(post("/api/orders")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.orderId").value("order-1"))
                .andExpect(jsonPath("$.data.approvalUrl").value("https://paypal.test/approve/PAYPAL-1"));

        verify(valueOps).set(eq("idempotency:order:key-1"), eq("order-1"), any(Duration.class));

        ArgumentCaptor<CheckoutCommand> command = ArgumentCaptor.forClass(CheckoutCommand.class);
        verify(orchestrator).createOrder(command.capture());
        assertThat(command.getValue().accessToken()).isEqualTo("Bearer token-1");
        assertThat(command.getValue().shipping().modeFor("P1", "standard")).isEqualTo("express");
        assertThat(command.getValue().shipping().modeFor("P2", "standard")).isEqualTo("standard");
        assertThat(command.getValue().shipping().address().getZipCode()).isEqualTo("560001");
    }

    @Test
    @DisplayName("같은 Idempotency-Key 재요청은 409 DUPLICATE_REQUEST, Saga를 실행하지 않는다")
    void createOrder_DuplicateKey() throws Exception {
        given(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(false);

        mockMvc.perform(post("/api/orders")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .header("Idempotency-Key", "key-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_REQUEST"));

        verify(orchestrator, never()).createOrder(any());
    }

    @Test
    @DisplayName("Saga 실패는 원래 오류 코드와 실패 단계를 ProblemDetail로, 멱등 키는 지운다")
    void createOrder_SagaFailure() throws Exception {
        // Given
        given(valueOps.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(true);
        given(orchestrator.createOrder(any(CheckoutCommand.class))).willThrow(new SagaStepException(
                SagaStep.RESERVE_STOCK, ErrorCode.INSUFFICIENT_STOCK,
                "Insufficient stock for product C: requested=3, available=1, shortfall=2"));

        // When & Then
        mockMvc.perform(post("/api/orders")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .header("Idempotency-Key", "key-2")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.type").value("https://shopflow.dev/errors/insufficient_stock"))
                .andExpect(jsonPath("$.step").value("reserve-stock"))
                .andExpect(jsonPath("$.detail").value(
                        "Insufficient stock for product C: requested=3, available=1, shortfall=2"));

        verify(redisTemplate).delete("idempotency:order:key-2");
    }

    @Test
    @DisplayName("Authorization 헤더가 없으면 400")
    void createOrder_MissingAuthorization() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CHECKOUT_BODY))
                .andExpect(status().isBadRequest());

        verify(orchestrator, never()).createOrder(any());
    }

    @Test
    @DisplayName("지원하지 않는 배송 모드는 400")
    void createOrder_InvalidShippingMode() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"user-1\",\"shippingMode\":\"drone\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }

    @Test
    @DisplayName("COD 주문은 멱등 키 없이도 동작한다")
    void createCodOrder_WithoutKey() throws Exception {
        given(orchestrator.createCodOrder(any(CheckoutCommand.class)))
                .willReturn(new CodOrderResult("order-9", new BigDecimal("640.00")));

        mockMvc.perform(post("/api/orders/cod")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer token-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userId\":\"user-1\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.orderId").value("order-9"))
                .andExpect(jsonPath("$.data.totalAmount").value(640.00));

        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("취소된 주문의 결제 확정은 200 + ok=false")
    void capture_AlreadyCancelled() throws Exception {
        given(orchestrator.capturePayment("order-1", "PAYPAL-1")).willReturn(
                CaptureResult.already("order-1", OrderStatus.CANCELLED, "PAYPAL-1", BigDecimal.TEN));

        mockMvc.perform(post("/api/orders/order-1/capture")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentReference\":\"PAYPAL-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ok").value(false))
                .andExpect(jsonPath("$.data.message").value("already cancelled"));
    }

    @Test
    @DisplayName("이미 완료된 주문 취소는 200 + already completed")
    void cancel_AlreadyCompleted() throws Exception {
        given(orchestrator.cancelOrder("order-1")).willReturn(CancelResult.already("completed"));

        mockMvc.perform(post("/api/orders/order-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ok").value(false))
                .andExpect(jsonPath("$.data.message").value("already completed"));
    }

    @Test
    @DisplayName("잘못된 페이지 크기는 서비스의 INVALID_INPUT이 400으로 나간다")
    void listOrders_InvalidPage() throws Exception {
        given(orderService.listOrders(eq("user-1"), any(), anyInt(), eq(500)))
                .willThrow(new BusinessException(ErrorCode.INVALID_INPUT,
                        "page must be >= 0 and size between 1 and 100"));

        mockMvc.perform(get("/api/orders").param("userId", "user-1").param("size", "500"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_INPUT"));
    }
}
