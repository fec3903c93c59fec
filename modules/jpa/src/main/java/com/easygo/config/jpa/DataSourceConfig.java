package com.easygo.config.jpa;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * 메인 데이터소스 설정.
 * <p>
 * {@code datasource.mysql-jpa.main} 하위 속성을 HikariCP 설정으로 바인딩합니다.
 * </p>
 */
@Configuration
public class DataSourceConfig {

    @Primary
    @Bean
    @ConfigurationProperties(prefix = "datasource.mysql-jpa.main")
    public HikariConfig mySqlMainHikariConfig() {
        return new HikariConfig();
    }

    @Primary
    @Bean
    public HikariDataSource mySqlMainDataSource(@Qualifier("mySqlMainHikariConfig") HikariConfig hikariConfig) {
        return new HikariDataSource(hikariConfig);
    }
}
