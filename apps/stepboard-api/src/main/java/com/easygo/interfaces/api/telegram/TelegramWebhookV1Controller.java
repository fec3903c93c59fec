package com.easygo.interfaces.api.telegram;

import com.easygo.application.chat.ChatMessageHandler;
import com.easygo.application.chat.IncomingMessage;
import com.easygo.infrastructure.telegram.TelegramDto;
import com.easygo.interfaces.api.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Telegram Webhook 수신 컨트롤러.
 * <p>
 * 일반 메시지와 채널 게시물을 모두 받으며, 텍스트가 없는 업데이트와 봇 명령({@code /start} 등)은 무시합니다.
 * 처리 결과와 관계없이 항상 성공으로 응답하여 Telegram이 같은 업데이트를 재전송하지 않도록 합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/telegram")
public class TelegramWebhookV1Controller {

    private static final String COMMAND_PREFIX = "/";

    private final ChatMessageHandler chatMessageHandler;
    private final Clock clock;

    @PostMapping("/updates")
    public ApiResponse<Object> receive(@RequestBody TelegramDto.Update update) {
        TelegramDto.Message message = update.effectiveMessage();
        if (message == null || message.chat() == null || message.effectiveText() == null) {
            log.debug("처리 대상이 아닌 업데이트: updateId={}", update.updateId());
            return ApiResponse.success();
        }
        if (message.effectiveText().startsWith(COMMAND_PREFIX)) {
            log.debug("봇 명령 무시: updateId={}", update.updateId());
            return ApiResponse.success();
        }

        chatMessageHandler.handle(new IncomingMessage(
            message.messageId(),
            message.chat().id(),
            message.from() != null ? message.from().id() : null,
            message.from() != null ? message.from().username() : null,
            message.effectiveText(),
            sentAt(message.date())
        ));
        return ApiResponse.success();
    }

    private ZonedDateTime sentAt(Long epochSeconds) {
        if (epochSeconds == null) {
            return ZonedDateTime.now(clock);
        }
        return Instant.ofEpochSecond(epochSeconds).atZone(clock.getZone());
    }
}
