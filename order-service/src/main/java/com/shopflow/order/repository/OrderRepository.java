package com.shopflow.order.repository;

import com.shopflow.order.entity.Order;
import com.shopflow.order.entity.OrderStatus;
import com.shopflow.order.entity.PaymentMethod;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 주문 저장소
 *
 * <h3>상태 전이 = 조건부 UPDATE (compare-and-set)</h3>
 * <pre>
 *   UPDATE orders SET status = :to, version = version + 1
 *    WHERE id = :id AND status IN (:from)
 *   → 1: 전이 성공 / 0: 이미 다른 상태 (동시 capture·cancel 중 패자, 또는 종료 상태)
 * </pre>
 * 읽고 나서 쓰는 사이에 다른 요청이 끼어들 틈이 없다.
 */
public interface OrderRepository extends JpaRepository<Order, String> {

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") String id);

    @Query("SELECT o.status FROM Order o WHERE o.id = :id")
    Optional<OrderStatus> findStatusById(@Param("id") String id);

    Page<Order> findByUserId(String userId, Pageable pageable);

    Page<Order> findByUserIdAndStatus(String userId, OrderStatus status, Pageable pageable);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Order o SET o.status = :to, o.updatedAt = :now, o.version = o.version + 1 "
            + "WHERE o.id = :id AND o.status IN :from")
    int transitionStatus(@Param("id") String id,
                         @Param("from") Collection<OrderStatus> from,
                         @Param("to") OrderStatus to,
                         @Param("now") LocalDateTime now);

    /** 결제 승인 없이 방치된 주문 ID */
    @Query("SELECT o.id FROM Order o WHERE o.status = :status AND o.paymentMethod = :method "
            + "AND o.createdAt < :cutoff ORDER BY o.createdAt ASC")
    List<String> findStaleIds(@Param("status") OrderStatus status,
                              @Param("method") PaymentMethod method,
                              @Param("cutoff") LocalDateTime cutoff,
                              Pageable pageable);
}
