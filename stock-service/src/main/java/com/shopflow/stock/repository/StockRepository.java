package com.shopflow.stock.repository;

import com.shopflow.stock.entity.Stock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 재고 원장 저장소
 *
 * <h3>조건부 UPDATE</h3>
 * <pre>
 * decrement: UPDATE ... SET on_hand = on_hand - :qty WHERE product_id = :id AND on_hand >= :qty
 *   → 영향 행 0 = 수량 부족 (음수 재고 방지)
 * increment: UPDATE ... SET on_hand = on_hand + :qty WHERE product_id = :id
 * </pre>
 * 읽고-쓰기 사이의 경합이 DB 한 문장 안에서 끝난다.
 */
public interface StockRepository extends JpaRepository<Stock, String> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Stock s SET s.onHand = s.onHand - :quantity, s.version = s.version + 1 "
            + "WHERE s.productId = :productId AND s.onHand >= :quantity")
    int decrement(@Param("productId") String productId, @Param("quantity") int quantity);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Stock s SET s.onHand = s.onHand + :quantity, s.version = s.version + 1 "
            + "WHERE s.productId = :productId")
    int increment(@Param("productId") String productId, @Param("quantity") int quantity);
}
