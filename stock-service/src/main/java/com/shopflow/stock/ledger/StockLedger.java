package com.shopflow.stock.ledger;

/**
 * 재고 원장 (Stock Ledger) - 상품별 on-hand 수량의 영속 기록
 *
 * <p>호출자는 StockReservationActor 하나뿐이다. 같은 상품에 대한 호출은
 * 액터 메일박스가 직렬화하므로 구현체는 상품 단위 동시성을 따로 고민하지 않는다.</p>
 *
 * <ul>
 *   <li>{@link JpaStockLedger} - 기본 (stock.ledger.store=jpa)</li>
 *   <li>{@link InMemoryStockLedger} - 로컬 실행/테스트 (stock.ledger.store=memory)</li>
 * </ul>
 */
public interface StockLedger {

    /** 현재 on-hand 수량. 원장에 없는 상품은 0. */
    int onHand(String productId);

    /**
     * 영구 차감. on-hand가 부족하면 INSUFFICIENT_STOCK.
     */
    void decrement(String productId, int quantity);

    /** 보상용 증가. 원장에 없는 상품이면 새로 만든다. */
    void increment(String productId, int quantity);

    /** 관리자 수량 설정 */
    void setOnHand(String productId, int onHand);
}
