package com.easygo.application.chat;

import com.easygo.application.report.ReportFacade;
import com.easygo.application.report.ReportInfo;
import com.easygo.config.StepboardProperties;
import com.easygo.domain.chat.ChatNotifier;
import com.easygo.domain.message.ChatMessage;
import com.easygo.domain.message.ChatMessageService;
import com.easygo.domain.report.ReportParser;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 채팅 메시지 처리기.
 * <p>
 * <b>처리 순서:</b>
 * <ol>
 *   <li>허용되지 않은 채팅의 메시지는 버립니다.</li>
 *   <li>메시지를 기록에 남깁니다. 기록 실패는 처리를 멈추지 않습니다.</li>
 *   <li>{@code #отчет}을 포함하면 보고로 처리하고 결과를 답장합니다.</li>
 * </ol>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ChatMessageHandler {

    public static final String SAVE_FAILED = "Ошибка сохранения данных";

    private final StepboardProperties properties;
    private final ChatMessageService chatMessageService;
    private final ReportParser reportParser;
    private final ReportFacade reportFacade;
    private final ChatNotifier chatNotifier;

    /**
     * 메시지를 처리합니다.
     *
     * @param message 수신 메시지
     */
    public void handle(IncomingMessage message) {
        if (message.text() == null || message.text().isBlank()) {
            return;
        }
        if (!properties.getChat().isAllowed(message.chatId())) {
            log.warn("허용되지 않은 채팅 메시지 무시: chatId={}, messageId={}", message.chatId(), message.messageId());
            return;
        }

        record(message);

        if (!reportParser.isReport(message.text())) {
            return;
        }

        String replyText;
        try {
            ReportInfo info = reportFacade.submit(message.userId(), message.text());
            replyText = "#" + info.nickname() + " - принято";
        } catch (CoreException e) {
            if (e.getErrorType() != ErrorType.BAD_REQUEST) {
                log.error("보고 처리 실패: chatId={}, messageId={}", message.chatId(), message.messageId(), e);
                replyText = SAVE_FAILED;
            } else {
                log.info("보고 거부: chatId={}, messageId={}, reason={}",
                    message.chatId(), message.messageId(), e.getMessage());
                replyText = e.getMessage();
            }
        } catch (Exception e) {
            log.error("보고 저장 실패: chatId={}, messageId={}", message.chatId(), message.messageId(), e);
            replyText = SAVE_FAILED;
        }
        chatNotifier.reply(message.chatId(), message.messageId(), replyText);
    }

    private void record(IncomingMessage message) {
        try {
            chatMessageService.record(new ChatMessage(
                message.messageId(),
                message.chatId(),
                message.userId(),
                message.username(),
                message.text(),
                message.sentAt()
            ));
        } catch (Exception e) {
            log.error("메시지 기록 실패: chatId={}, messageId={}", message.chatId(), message.messageId(), e);
        }
    }
}
