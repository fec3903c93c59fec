package com.easygo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 날짜 계산에 사용하는 {@link Clock} 설정.
 * <p>
 * {@code stepboard.zone} 시간대를 기준으로 하는 시스템 시계를 제공합니다.
 * </p>
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(StepboardProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
