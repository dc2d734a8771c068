package com.shopflow.stock.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * 재고 원장(Stock Ledger) 엔티티 - 상품별 실제 보유 수량
 *
 * <h3>설계 포인트</h3>
 * <ul>
 *   <li>productId를 그대로 PK로 사용 (카탈로그 서비스의 상품 ID, FK 없음)</li>
 *   <li>onHand는 예약으로는 절대 바뀌지 않는다. reduce(영구 차감), restore(보상), 관리자 설정으로만 변경</li>
 *   <li>@Version: 관리자 수량 설정과 차감이 엇갈리면 충돌 감지</li>
 * </ul>
 */
@Entity
@Table(name = "stock")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@EntityListeners(AuditingEntityListener.class)
public class Stock {

    @Id
    @Column(length = 64)
    private String productId;

    @Version
    private Long version;

    @Column(nullable = false)
    private int onHand;

    @LastModifiedDate
    private LocalDateTime updatedAt;

    public Stock(String productId, int onHand) {
        this.productId = productId;
        this.onHand = onHand;
    }

    public void changeOnHand(int onHand) {
        this.onHand = onHand;
    }
}
