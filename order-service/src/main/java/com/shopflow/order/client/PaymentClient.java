package com.shopflow.order.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 결제 서비스 (PayPal) Feign 클라이언트
 *
 * <pre>
 *   POST /paypal/create  {amount, currency, description, returnUrl, cancelUrl}
 *     → {orderId, links[{rel, href}]}       rel=approve 링크로 사용자를 보낸다
 *   POST /paypal/capture {orderId, internalOrderId}
 *     → {status, payerAddress?}             status=COMPLETED 가 아니면 실패
 * </pre>
 */
@FeignClient(name = "payment-service", url = "${payment-service.url:http://localhost:8086}")
public interface PaymentClient {

    String CAPTURE_COMPLETED = "COMPLETED";

    @PostMapping("/paypal/create")
    PaymentOrder create(@RequestBody CreatePaymentRequest request);

    @PostMapping("/paypal/capture")
    CaptureResult capture(@RequestBody CapturePaymentRequest request);

    record CreatePaymentRequest(BigDecimal amount, String currency, String description,
                                String returnUrl, String cancelUrl) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PaymentOrder(String orderId, List<Link> links) {
        public Optional<String> approvalLink() {
            if (links == null) {
                return Optional.empty();
            }
            return links.stream()
                    .filter(link -> "approve".equals(link.rel()))
                    .map(Link::href)
                    .findFirst();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Link(String rel, String href) {}

    record CapturePaymentRequest(String orderId, String internalOrderId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CaptureResult(String status, Object payerAddress) {
        public boolean completed() {
            return status == null || CAPTURE_COMPLETED.equalsIgnoreCase(status);
        }
    }
}
