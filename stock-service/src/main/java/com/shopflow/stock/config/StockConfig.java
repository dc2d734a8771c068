package com.shopflow.stock.config;

import com.shopflow.stock.reservation.ReservationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 예약 액터 설정. 만료 판정에 쓰는 Clock을 빈으로 두어 테스트에서 교체할 수 있게 한다.
 */
@Configuration
@EnableConfigurationProperties(ReservationProperties.class)
public class StockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
