package com.easygo.infrastructure.telegram;

import com.easygo.domain.chat.ChatNotifier;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Telegram Bot API 기반 ChatNotifier 구현체.
 * <p>
 * 전송 실패는 경고 로그만 남기고 호출자에게 전파하지 않습니다.
 * 답장 실패가 이미 저장된 보고나 메달 배정을 되돌리지 않아야 하기 때문입니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TelegramChatNotifier implements ChatNotifier {

    private final TelegramBotClient telegramBotClient;

    @Override
    public void reply(Long chatId, Long replyToMessageId, String text) {
        sendMessage(new TelegramDto.SendMessageRequest(chatId, text, replyToMessageId));
    }

    @Override
    public void send(Long chatId, String text) {
        sendMessage(new TelegramDto.SendMessageRequest(chatId, text, null));
    }

    private void sendMessage(TelegramDto.SendMessageRequest request) {
        try {
            TelegramDto.ApiResponse<TelegramDto.Message> response = telegramBotClient.sendMessage(request);
            if (response == null || !response.ok()) {
                log.warn("Telegram 메시지 전송 거부: chatId={}, description={}",
                    request.chatId(), response != null ? response.description() : null);
                return;
            }
            log.debug("Telegram 메시지 전송: chatId={}, messageId={}",
                request.chatId(), response.result() != null ? response.result().messageId() : null);
        } catch (FeignException e) {
            log.warn("Telegram 메시지 전송 실패: chatId={}, status={}", request.chatId(), e.status(), e);
        }
    }
}
