package com.shopflow.stock.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 설정. Stock.updatedAt (@LastModifiedDate)에 적용된다.
 * 슬라이스 테스트(@WebMvcTest)가 JPA 없이 뜨도록 애플리케이션 클래스와 분리해 둔다.
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
