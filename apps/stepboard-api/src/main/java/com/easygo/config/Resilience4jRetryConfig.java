package com.easygo.config;

import feign.FeignException;
import feign.RetryableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Resilience4j Retry 설정.
 * <p>
 * <b>Retry 정책:</b>
 * <ul>
 *   <li><b>Google Sheets (googleSheets):</b> Exponential Backoff 적용. 메달 배정 스케줄러와
 *       보고 처리 모두 시트를 보조 출력으로만 사용하므로 재시도해도 안전합니다.</li>
 *   <li><b>Telegram 답장:</b> Retry 없음 (사용자 메시지 처리 경로 - 빠른 실패)</li>
 * </ul>
 * </p>
 * <p>
 * <b>Exponential Backoff 전략:</b>
 * <ul>
 *   <li><b>초기 대기 시간:</b> 500ms</li>
 *   <li><b>배수(multiplier):</b> 2</li>
 *   <li><b>최대 대기 시간:</b> 5초</li>
 * </ul>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Configuration
public class Resilience4jRetryConfig {

    public static final String GOOGLE_SHEETS = "googleSheets";

    @Bean
    public RetryRegistry retryRegistry() {
        RetryRegistry retryRegistry = RetryRegistry.ofDefaults();

        IntervalFunction intervalFunction = IntervalFunction
            .ofExponentialRandomBackoff(
                Duration.ofMillis(500),  // 초기 대기 시간
                2.0,                      // 배수
                Duration.ofSeconds(5)     // 최대 대기 시간
            );

        RetryConfig sheetsRetryConfig = RetryConfig.custom()
            .maxAttempts(3)  // 초기 시도 포함
            .intervalFunction(intervalFunction)
            .retryOnException(Resilience4jRetryConfig::isTransient)
            .build();

        retryRegistry.retry(GOOGLE_SHEETS, sheetsRetryConfig);

        log.info("Resilience4j Retry 설정 완료: {} (maxAttempts=3, exponential backoff)", GOOGLE_SHEETS);
        return retryRegistry;
    }

    /**
     * 일시적 오류(5xx, 429, 네트워크 오류, 타임아웃)만 재시도합니다.
     */
    static boolean isTransient(Throwable throwable) {
        if (throwable instanceof RetryableException) {
            return true;
        }
        if (throwable instanceof FeignException feignException) {
            int status = feignException.status();
            if (status == 429 || (status >= 500 && status < 600)) {
                log.debug("재시도 대상 예외: FeignException (status: {})", status);
                return true;
            }
            return false;
        }
        return throwable instanceof SocketTimeoutException || throwable instanceof TimeoutException;
    }
}
