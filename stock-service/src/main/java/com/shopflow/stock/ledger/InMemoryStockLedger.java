package com.shopflow.stock.ledger;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 메모리 원장. 프로세스가 내려가면 수량도 사라진다.
 */
@Component
@ConditionalOnProperty(name = "stock.ledger.store", havingValue = "memory")
public class InMemoryStockLedger implements StockLedger {

    private final Map<String, Integer> onHand = new ConcurrentHashMap<>();

    @Override
    public int onHand(String productId) {
        return onHand.getOrDefault(productId, 0);
    }

    @Override
    public void decrement(String productId, int quantity) {
        onHand.compute(productId, (id, current) -> {
            int value = current == null ? 0 : current;
            if (value < quantity) {
                throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK,
                        "Ledger cannot decrement product " + productId + " by " + quantity);
            }
            return value - quantity;
        });
    }

    @Override
    public void increment(String productId, int quantity) {
        onHand.merge(productId, quantity, Integer::sum);
    }

    @Override
    public void setOnHand(String productId, int quantity) {
        onHand.put(productId, quantity);
    }
}
