package com.easygo.config.jpa;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * JPA 설정.
 * <p>
 * 엔티티는 {@code com.easygo.domain}, Spring Data 리포지토리는
 * {@code com.easygo.infrastructure} 하위에서 스캔합니다.
 * </p>
 */
@Configuration
@EnableTransactionManagement
@EntityScan(basePackages = "com.easygo.domain")
@EnableJpaRepositories(basePackages = "com.easygo.infrastructure")
public class JpaConfig {
}
