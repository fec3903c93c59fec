package com.easygo.infrastructure.telegram;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

/**
 * Telegram Bot API FeignClient.
 * <p>
 * 봇 토큰은 경로({@code /bot<token>})에 포함됩니다.
 * </p>
 */
@FeignClient(
    name = "telegramBotClient",
    url = "${stepboard.telegram.url}",
    path = "/bot${stepboard.telegram.token}"
)
public interface TelegramBotClient {

    /**
     * 메시지를 전송합니다.
     *
     * @param request 전송 요청
     * @return 전송된 메시지
     */
    @PostMapping("/sendMessage")
    TelegramDto.ApiResponse<TelegramDto.Message> sendMessage(@RequestBody TelegramDto.SendMessageRequest request);
}
