package com.easygo.infrastructure.sheet;

import com.easygo.config.StepboardProperties;
import feign.RequestInterceptor;
import org.springframework.context.annotation.Bean;
import org.springframework.http.HttpHeaders;

/**
 * GoogleSheetsClient 전용 Feign 설정.
 * <p>
 * 다른 FeignClient에 적용되지 않도록 {@code @Configuration}을 붙이지 않습니다.
 * 요청마다 서비스 계정 토큰을 확인하여 만료된 경우 갱신한 뒤 헤더에 넣습니다.
 * </p>
 */
public class GoogleSheetsClientConfig {

    @Bean
    public GoogleAccessTokenProvider googleAccessTokenProvider(StepboardProperties properties) {
        return new GoogleAccessTokenProvider(properties.getSheets().getCredentialsPath());
    }

    @Bean
    public RequestInterceptor googleSheetsAuthInterceptor(GoogleAccessTokenProvider tokenProvider) {
        return template -> template.header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.currentToken());
    }
}
