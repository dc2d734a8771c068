package com.shopflow.order.saga;

import com.shopflow.common.dto.ApiResponse;
import com.shopflow.common.dto.stock.ReduceStockRequest;
import com.shopflow.common.dto.stock.ReleaseStockRequest;
import com.shopflow.common.dto.stock.ReservationResponse;
import com.shopflow.common.dto.stock.ReserveStockRequest;
import com.shopflow.common.dto.stock.StockStatusResponse;
import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.order.client.CartClient;
import com.shopflow.order.client.CartClient.Cart;
import com.shopflow.order.client.CartClient.CartItem;
import com.shopflow.order.client.CartClient.CartValidation;
import com.shopflow.order.client.PaymentClient;
import com.shopflow.order.client.PaymentClient.CreatePaymentRequest;
import com.shopflow.order.client.PaymentClient.PaymentOrder;
import com.shopflow.order.client.PricingClient;
import com.shopflow.order.client.PricingClient.ShippingQuote;
import com.shopflow.order.client.StockClient;
import com.shopflow.order.config.SagaProperties;
import com.shopflow.order.dto.CancelResult;
import com.shopflow.order.dto.CaptureResult;
import com.shopflow.order.dto.CheckoutResult;
import com.shopflow.order.dto.CodOrderResult;
import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderItem;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.PaymentMethod;
import com.shopflow.order.entity.ShippingAddress;
import com.shopflow.order.event.OrderStatusPublisher;
import com.shopflow.order.repository.OrderRepository;
import com.shopflow.order.saga.CompensationStep.MarkOrderCancelled;
import com.shopflow.order.saga.CompensationStep.MarkOrderFailed;
import com.shopflow.order.saga.CompensationStep.ReleaseReservation;
import com.shopflow.order.saga.CompensationStep.RestoreStock;
import com.shopflow.order.saga.CompensationStep.VoidPaymentNote;
import com.shopflow.order.saga.SagaFanOut.Outcome;
import com.shopflow.order.service.OrderStatusTransitions;
import com.shopflow.order.service.ShippingQuoteService;
import io.github.resilience4j.bulkhead.annotation.Bulkhead;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 주문 Saga 오케스트레이터 - 동기 HTTP 호출 + 보상 로그
 *
 * <h3>공통 규칙</h3>
 * 부수 효과가 있는 단계가 성공하면 즉시 보상을 기록한다. 어느 단계든 실패하면
 * 기록된 보상을 역순으로 모두 실행하고, 주문이 만들어졌고 아직 종료 상태가 아니면 FAILED로 바꾼 뒤,
 * 실패한 단계가 표시된 원래 오류(SagaStepException)를 던진다.
 *
 * <h3>createOrder (PayPal)</h3>
 * <pre>
 *   1. 장바구니 조회        비었으면 CART_EMPTY
 *   2. 장바구니 검증        가격 변경은 수용(새 가격 사용), 재고 부족 등은 CART_INVALID
 *   3. 배송비 견적 (팬아웃) 카테고리 → 모드별 배송비/소요일
 *   4. 총액 확인            0 이하면 INVALID_AMOUNT
 *   5. PayPal 결제 생성     → [보상] 결제 무효 기록
 *   6. 주문 저장 (PENDING)  → [보상] 주문 취소
 *   7. 재고 예약 (팬아웃)   → [보상] 항목별 예약 해제. 그 사이 주문이 취소되었으면 보상 후 실패
 *   8. 승인 URL 반환        (재고 차감, 장바구니 비우기는 결제 확정 때)
 * </pre>
 *
 * <h3>capturePayment</h3>
 * <pre>
 *   1. 주문 확인            PENDING PayPal 주문 + 결제 참조 일치 (PENDING이 아니면 ok=false)
 *   2. 결제 확정            실패하거나 응답 본문이 없으면 보상 없이 중단 (주문은 PENDING 유지)
 *                          → [보상] 환불 기록
 *   3. PENDING → PROCESSING 점유 (동시 취소/중복 확정을 감지)
 *                          → [보상] 주문 FAILED, 전 항목 예약 해제
 *   4. 재고 차감 (팬아웃)   → [보상] 항목별 on-hand 복구
 *   5. 장바구니 비우기      실패해도 계속
 *   6. PROCESSING → COMPLETED
 * </pre>
 * 3 또는 6의 조건부 전이가 실패하면 다른 요청이 이긴 것이다. 자기 보상만 실행한 뒤 ok=false를 돌려준다.
 *
 * <h3>cancelOrder / createCodOrder</h3>
 * cancel은 PENDING|PROCESSING에서만 CANCELLED로 바꾸고 예약을 해제한다. 이미 끝난 주문이면
 * 오류 대신 {@code {ok:false, "already <status>"}}. COD는 1~4단계 후 주문 저장, 예약, 차감,
 * 장바구니 비우기, 완료를 한 번에 진행한다.
 *
 * ★ Compensation is recorded right after each side effect, never before,
 *   so an unwind undoes exactly what happened.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderSagaOrchestrator {

    private static final String BEARER = "Bearer ";

    private final CartClient cartClient;
    private final PaymentClient paymentClient;
    private final StockClient stockClient;
    private final ShippingQuoteService shippingQuoteService;
    private final OrderRepository orderRepository;
    private final OrderStatusTransitions transitions;
    private final OrderStatusPublisher statusPublisher;
    private final CompensationExecutor compensationExecutor;
    private final SagaFanOut fanOut;
    private final SagaProperties properties;

    // ────────────────────────────── createOrder (PayPal) ──────────────────────────────

    @Bulkhead(name = "orderCreation")
    public CheckoutResult createOrder(CheckoutCommand command) {
        CheckoutState state = new CheckoutState(command);
        log.info("Checkout saga started: userId={}, paymentMethod=PAYPAL", command.userId());
        try {
            priceCart(state);

            state.setStep(SagaStep.CREATE_PAYMENT);
            PaymentOrder payment = paymentClient.create(new CreatePaymentRequest(
                    state.getTotalAmount(),
                    properties.getCurrency(),
                    "Order for " + state.getLines().size() + " items",
                    properties.getFrontendOrigin() + "/paypal-return",
                    properties.getFrontendOrigin() + "/checkout"));
            if (payment == null || !StringUtils.hasText(payment.orderId())) {
                throw new BusinessException(ErrorCode.PAYMENT_FAILED, "Payment provider returned no order id");
            }
            state.setPayment(payment);
            state.getCompensations().push(new VoidPaymentNote(payment.orderId(), null, state.getTotalAmount(), false));
            String approvalUrl = payment.approvalLink()
                    .orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_FAILED,
                            "Payment " + payment.orderId() + " has no approval link"));

            persistOrder(state, PaymentMethod.PAYPAL, payment.orderId());
            reserveAll(state);

            Order order = state.getOrder();
            // 예약 도중 취소되었다면 취소가 먼저 해제한 뒤 도착한 예약이 남는다
            if (orderRepository.findStatusById(order.getId()).orElse(null) != OrderStatus.PENDING) {
                throw conflictWithCurrentStatus(order.getId());
            }
            statusPublisher.publish(order.getId(), order.getUserId(), OrderStatus.PENDING);
            log.info("Checkout saga awaiting payment approval: orderId={}, paymentReference={}, total={}",
                    order.getId(), payment.orderId(), order.getTotalAmount());
            return new CheckoutResult(order.getId(), payment.orderId(), approvalUrl, order.getTotalAmount());
        } catch (RuntimeException e) {
            throw abort(state.getStep(), e, state.getCompensations(), state.getOrder());
        }
    }

    // ────────────────────────────── createCodOrder ──────────────────────────────

    @Bulkhead(name = "orderCreation")
    public CodOrderResult createCodOrder(CheckoutCommand command) {
        CheckoutState state = new CheckoutState(command);
        log.info("Checkout saga started: userId={}, paymentMethod=COD", command.userId());
        try {
            priceCart(state);
            persistOrder(state, PaymentMethod.COD, null);
            reserveAll(state);

            Order order = state.getOrder();
            state.setStep(SagaStep.CLAIM_ORDER);
            if (!transitions.move(order.getId(), order.getUserId(), OrderStatus.PENDING, OrderStatus.PROCESSING)) {
                throw conflictWithCurrentStatus(order.getId());
            }

            state.setStep(SagaStep.REDUCE_STOCK);
            reduceAll(state.getCompensations(), order);
            clearCart(order);

            state.setStep(SagaStep.COMPLETE_ORDER);
            if (!transitions.move(order.getId(), order.getUserId(), OrderStatus.PROCESSING, OrderStatus.COMPLETED)) {
                throw conflictWithCurrentStatus(order.getId());
            }
            log.info("COD order completed: orderId={}, total={}", order.getId(), order.getTotalAmount());
            return new CodOrderResult(order.getId(), order.getTotalAmount());
        } catch (RuntimeException e) {
            throw abort(state.getStep(), e, state.getCompensations(), state.getOrder());
        }
    }

    // ────────────────────────────── capturePayment ──────────────────────────────

    public CaptureResult capturePayment(String orderId, String paymentReference) {
        CaptureState state = new CaptureState(orderId, paymentReference);
        try {
            Order order = orderRepository.findWithItemsById(orderId)
                    .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));
            state.setOrder(order);
            if (order.getPaymentMethod() != PaymentMethod.PAYPAL) {
                throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                        "Order " + orderId + " is not a PayPal order");
            }
            if (order.getStatus() != OrderStatus.PENDING) {
                log.info("Capture ignored: orderId={}, status={}", orderId, order.getStatus());
                return CaptureResult.already(orderId, order.getStatus(), paymentReference, order.getTotalAmount());
            }
            if (!order.getPaymentReference().equals(paymentReference)) {
                throw new BusinessException(ErrorCode.PAYMENT_REFERENCE_MISMATCH,
                        "Payment " + paymentReference + " does not belong to order " + orderId);
            }

            state.setStep(SagaStep.CAPTURE_PAYMENT);
            PaymentClient.CaptureResult capture = paymentClient.capture(
                    new PaymentClient.CapturePaymentRequest(paymentReference, orderId));
            if (capture == null) {
                throw new BusinessException(ErrorCode.PAYMENT_FAILED,
                        "Payment " + paymentReference + " capture returned no body");
            }
            if (!capture.completed()) {
                throw new BusinessException(ErrorCode.PAYMENT_FAILED,
                        "Payment " + paymentReference + " capture status: " + capture.status());
            }
            state.setCaptured(true);
            log.info("Payment captured: orderId={}, paymentReference={}", orderId, paymentReference);

            CompensationLog compensations = state.getCompensations();
            compensations.push(new VoidPaymentNote(paymentReference, orderId, order.getTotalAmount(), true));

            // 주문 상태와 예약은 PENDING → PROCESSING 을 선점한 Saga만 건드린다
            state.setStep(SagaStep.CLAIM_ORDER);
            if (!transitions.move(orderId, order.getUserId(), OrderStatus.PENDING, OrderStatus.PROCESSING)) {
                return lostRace(state);
            }
            state.setClaimed(true);
            compensations.push(new MarkOrderFailed(orderId, order.getUserId()));
            for (OrderItem item : order.getItems()) {
                compensations.push(new ReleaseReservation(item.getProductId(), orderId));
            }

            state.setStep(SagaStep.REDUCE_STOCK);
            reduceAll(compensations, order);
            clearCart(order);

            state.setStep(SagaStep.COMPLETE_ORDER);
            if (!transitions.move(orderId, order.getUserId(), OrderStatus.PROCESSING, OrderStatus.COMPLETED)) {
                return lostRace(state);
            }
            log.info("Capture saga completed: orderId={}, total={}", orderId, order.getTotalAmount());
            return CaptureResult.completed(orderId, paymentReference, order.getTotalAmount());
        } catch (RuntimeException e) {
            // 결제 확정 전 실패는 부수 효과가 없다. 주문은 PENDING으로 남아 재시도/취소할 수 있다
            if (!state.isCaptured()) {
                throw SagaStepException.of(state.getStep(), e);
            }
            // 선점 전이면 주문은 다른 Saga 소유일 수 있다. 환불 기록만 남긴다
            if (!state.isClaimed()) {
                SagaStepException failure = SagaStepException.of(state.getStep(), e);
                log.warn("Capture failed before claim: orderId={}, step={}, code={}",
                        orderId, state.getStep().slug(), failure.getErrorCode());
                compensationExecutor.unwind(state.getCompensations(), failure);
                throw failure;
            }
            // 취소가 예약을 먼저 풀어 차감이 실패한 경우도 경합에서 진 것으로 본다
            if (orderRepository.findStatusById(orderId).orElse(null) == OrderStatus.CANCELLED) {
                return lostRace(state);
            }
            throw abort(state.getStep(), e, state.getCompensations(), state.getOrder());
        }
    }

    // ────────────────────────────── cancelOrder ──────────────────────────────

    public CancelResult cancelOrder(String orderId) {
        Order order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new BusinessException(ErrorCode.ORDER_NOT_FOUND, "Order not found: " + orderId));

        if (!transitions.cancel(orderId, order.getUserId())) {
            OrderStatus current = orderRepository.findStatusById(orderId).orElse(order.getStatus());
            log.info("Cancel ignored: orderId={}, status={}", orderId, current);
            return CancelResult.already(current.label());
        }

        for (OrderItem item : order.getItems()) {
            try {
                stockClient.release(item.getProductId(), new ReleaseStockRequest(orderId));
            } catch (RuntimeException e) {
                log.warn("Release after cancel failed, hold expires by TTL: orderId={}, productId={}, error={}",
                        orderId, item.getProductId(), e.getMessage());
            }
        }
        log.info("Order cancelled: orderId={}", orderId);
        return CancelResult.cancelled();
    }

    // ────────────────────────────── steps ──────────────────────────────

    /** 1~4단계: 장바구니 조회/검증, 배송비 견적, 총액 확인. 부수 효과 없음 */
    private void priceCart(CheckoutState state) {
        CheckoutCommand command = state.getCommand();

        state.setStep(SagaStep.FETCH_CART);
        Cart cart = cartClient.getCart(bearer(command.accessToken()));
        if (cart == null || cart.isEmpty()) {
            throw new BusinessException(ErrorCode.CART_EMPTY, "Cart is empty");
        }
        state.setCart(cart);

        state.setStep(SagaStep.VALIDATE_CART);
        CartValidation validation = cartClient.validate(new CartClient.ValidateCartRequest(cart.cartId()));
        if (validation == null || !validation.valid()) {
            List<String> errors = validation == null || validation.errors() == null ? List.of() : validation.errors();
            throw new BusinessException(ErrorCode.CART_INVALID, "Cart validation failed: " + String.join("; ", errors));
        }
        state.setItems(currentItems(cart, validation, command.accessToken()));
        for (CartItem item : state.getItems()) {
            if (item.quantity() <= 0 || item.price() == null || item.price().signum() < 0) {
                throw new BusinessException(ErrorCode.CART_INVALID, "Invalid cart line for product " + item.productId());
            }
        }

        state.setStep(SagaStep.QUOTE_SHIPPING);
        ShippingSelection shipping = command.shipping();
        PricingClient.Address address = pricingAddress(shipping.address());
        List<PricedLine> lines = requireAll(fanOut.run(state.getItems(), item -> {
            String category = shippingQuoteService.resolveCategory(item.productId());
            String mode = shipping.modeFor(item.productId(), properties.getDefaultShippingMode());
            ShippingQuote quote = shippingQuoteService.quote(new PricingClient.ShippingRequest(
                    category, mode, item.quantity(), address, item.productId()));
            return new PricedLine(item.productId(), item.quantity(), item.price(),
                    quote.cost(), quote.estimatedDays(), mode, category);
        }), "Shipping quote");
        state.setLines(lines);

        state.setStep(SagaStep.CHECK_AMOUNT);
        BigDecimal total = lines.stream().map(PricedLine::total).reduce(BigDecimal.ZERO, BigDecimal::add);
        if (total.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_AMOUNT, "Invalid amount: " + total);
        }
        state.setTotalAmount(total);
    }

    /** 가격이 바뀌었으면 장바구니 서비스가 저장한 새 가격을 쓴다 */
    private List<CartItem> currentItems(Cart cart, CartValidation validation, String accessToken) {
        if (validation.updatedItems() != null && !validation.updatedItems().isEmpty()) {
            log.info("Cart prices changed, using updated items: cartId={}", cart.cartId());
            return validation.updatedItems();
        }
        if (validation.cartUpdated()) {
            Cart refreshed = cartClient.getCart(bearer(accessToken));
            if (refreshed == null || refreshed.isEmpty()) {
                throw new BusinessException(ErrorCode.CART_EMPTY, "Cart is empty");
            }
            log.info("Cart prices changed, re-read cart: cartId={}", cart.cartId());
            return refreshed.items();
        }
        return cart.items();
    }

    private void persistOrder(CheckoutState state, PaymentMethod method, String paymentReference) {
        state.setStep(SagaStep.PERSIST_ORDER);
        CheckoutCommand command = state.getCommand();
        Order order = Order.builder()
                .userId(command.userId())
                .cartId(state.getCart().cartId())
                .paymentMethod(method)
                .paymentReference(paymentReference)
                .shippingAddress(command.shipping().address())
                .build();
        state.getLines().forEach(line -> order.addItem(line.toOrderItem()));

        Order saved = orderRepository.save(order);
        state.setOrder(saved);
        state.getCompensations().push(new MarkOrderCancelled(saved.getId(), saved.getUserId()));
        log.info("Order persisted: orderId={}, userId={}, items={}, total={}",
                saved.getId(), saved.getUserId(), saved.getItems().size(), saved.getTotalAmount());
    }

    /** 예약 성공 항목과 응답을 못 받은 항목(시간 초과) 모두 해제 보상을 기록한다 */
    private void reserveAll(CheckoutState state) {
        state.setStep(SagaStep.RESERVE_STOCK);
        Order order = state.getOrder();
        int ttlMinutes = (int) Math.max(1, properties.getReservationTtl().toMinutes());

        List<Outcome<PricedLine, ApiResponse<ReservationResponse>>> outcomes = fanOut.run(state.getLines(), line ->
                stockClient.reserve(line.productId(),
                        new ReserveStockRequest(line.quantity(), order.getId(), ttlMinutes)));
        for (Outcome<PricedLine, ApiResponse<ReservationResponse>> outcome : outcomes) {
            if (outcome.succeeded() || outcome.timedOut()) {
                state.getCompensations().push(new ReleaseReservation(outcome.input().productId(), order.getId()));
            }
        }
        requireAll(outcomes, "Stock reservation");
        log.info("Stock reserved for order: orderId={}, lines={}", order.getId(), outcomes.size());
    }

    /** 차감이 확인된 항목만 복구 보상을 기록한다. 시간 초과 항목은 수동 확인 대상 */
    private void reduceAll(CompensationLog compensations, Order order) {
        List<Outcome<OrderItem, ApiResponse<StockStatusResponse>>> outcomes = fanOut.run(order.getItems(), item ->
                stockClient.reduce(item.getProductId(),
                        new ReduceStockRequest(item.getQuantity(), order.getId())));
        for (Outcome<OrderItem, ApiResponse<StockStatusResponse>> outcome : outcomes) {
            OrderItem item = outcome.input();
            if (outcome.succeeded()) {
                compensations.push(new RestoreStock(item.getProductId(), order.getId(), item.getQuantity()));
            } else if (outcome.timedOut()) {
                log.error("{}: stock reduce outcome unknown: orderId={}, productId={}, quantity={}",
                        CompensationExecutor.MANUAL_RECONCILIATION, order.getId(),
                        item.getProductId(), item.getQuantity());
            }
        }
        requireAll(outcomes, "Stock reduce");
    }

    /** 비우기 실패는 주문 결과에 영향을 주지 않는다 */
    private void clearCart(Order order) {
        if (!StringUtils.hasText(order.getCartId())) {
            return;
        }
        try {
            cartClient.clear(order.getCartId());
        } catch (RuntimeException e) {
            log.warn("Cart clear failed (ignored): orderId={}, cartId={}, error={}",
                    order.getId(), order.getCartId(), e.getMessage());
        }
    }

    // ────────────────────────────── failure handling ──────────────────────────────

    private SagaStepException abort(SagaStep step, RuntimeException e, CompensationLog compensations, Order order) {
        SagaStepException failure = SagaStepException.of(step, e);
        log.warn("Saga failed: step={}, code={}, message={}, compensations={}",
                step.slug(), failure.getErrorCode(), failure.getMessage(), compensations.size());

        compensationExecutor.unwind(compensations, failure);
        if (order != null) {
            transitions.fail(order.getId(), order.getUserId());
        }
        return failure;
    }

    /**
     * 결제 확정 중 다른 요청(취소, 중복 확정)이 먼저 상태를 바꾼 경우. 이긴 쪽의 결과를 유지하도록
     * 이 Saga가 기록한 보상만 되돌리고 오류 대신 "already &lt;status&gt;"를 돌려준다.
     * 선점 전에 졌다면 기록에는 환불 메모만 있다.
     */
    private CaptureResult lostRace(CaptureState state) {
        Order order = state.getOrder();
        OrderStatus current = orderRepository.findStatusById(order.getId()).orElse(order.getStatus());
        SagaStepException conflict = new SagaStepException(state.getStep(), ErrorCode.INVALID_ORDER_STATUS,
                "Order " + order.getId() + " changed concurrently: already " + current.label());
        log.warn("Capture lost race: orderId={}, step={}, status={}", order.getId(), state.getStep().slug(), current);
        compensationExecutor.unwind(state.getCompensations(), conflict);
        return CaptureResult.already(order.getId(), current, state.getPaymentReference(), order.getTotalAmount());
    }

    private BusinessException conflictWithCurrentStatus(String orderId) {
        String status = orderRepository.findStatusById(orderId)
                .map(OrderStatus::label)
                .orElse("missing");
        return new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                "Order " + orderId + " changed concurrently: already " + status);
    }

    /**
     * 모든 항목이 성공해야 결과를 돌려준다. 업무 오류(재고 부족 등)를 시간 초과보다 먼저 보고한다.
     */
    private static <T, R> List<R> requireAll(List<Outcome<T, R>> outcomes, String what) {
        Optional<Throwable> error = outcomes.stream()
                .map(Outcome::error)
                .filter(Objects::nonNull)
                .findFirst();
        if (error.isPresent()) {
            Throwable cause = error.get();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new BusinessException(ErrorCode.EXTERNAL_SERVICE_ERROR, what + " failed: " + cause.getMessage(), cause);
        }
        long timedOut = outcomes.stream().filter(Outcome::timedOut).count();
        if (timedOut > 0) {
            throw new BusinessException(ErrorCode.REQUEST_TIMEOUT,
                    what + " timed out for " + timedOut + " of " + outcomes.size() + " items");
        }
        return outcomes.stream().map(Outcome::result).toList();
    }

    private static PricingClient.Address pricingAddress(ShippingAddress address) {
        if (address == null) {
            return new PricingClient.Address(null, null, null);
        }
        return new PricingClient.Address(address.getZipCode(), address.getCity(), address.getState());
    }

    private static String bearer(String accessToken) {
        if (accessToken == null) {
            return null;
        }
        return accessToken.startsWith(BEARER) ? accessToken : BEARER + accessToken;
    }
}
