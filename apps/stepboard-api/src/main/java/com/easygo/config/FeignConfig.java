package com.easygo.config;

import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Configuration;

/**
 * 외부 HTTP 연동(Telegram Bot API, Google Sheets API)용 FeignClient 설정.
 */
@Configuration
@EnableFeignClients(basePackages = "com.easygo.infrastructure")
public class FeignConfig {
}
