package com.shopflow.stock.ledger;

import com.shopflow.common.exception.BusinessException;
import com.shopflow.common.exception.ErrorCode;
import com.shopflow.stock.entity.Stock;
import com.shopflow.stock.repository.StockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "stock.ledger.store", havingValue = "jpa", matchIfMissing = true)
public class JpaStockLedger implements StockLedger {

    private final StockRepository stockRepository;

    @Override
    @Transactional(readOnly = true)
    public int onHand(String productId) {
        return stockRepository.findById(productId)
                .map(Stock::getOnHand)
                .orElse(0);
    }

    @Override
    @Transactional
    public void decrement(String productId, int quantity) {
        int updated = stockRepository.decrement(productId, quantity);
        if (updated == 0) {
            throw new BusinessException(ErrorCode.INSUFFICIENT_STOCK,
                    "Ledger cannot decrement product " + productId + " by " + quantity);
        }
        log.debug("Ledger decremented: productId={}, quantity={}", productId, quantity);
    }

    @Override
    @Transactional
    public void increment(String productId, int quantity) {
        if (stockRepository.increment(productId, quantity) == 0) {
            stockRepository.save(new Stock(productId, quantity));
        }
        log.debug("Ledger incremented: productId={}, quantity={}", productId, quantity);
    }

    @Override
    @Transactional
    public void setOnHand(String productId, int onHand) {
        Stock stock = stockRepository.findById(productId)
                .orElseGet(() -> new Stock(productId, onHand));
        stock.changeOnHand(onHand);
        stockRepository.save(stock);
    }
}
