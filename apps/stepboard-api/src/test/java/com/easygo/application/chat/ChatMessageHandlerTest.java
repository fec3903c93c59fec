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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ChatMessageHandlerTest {

    private static final Long CHAT_ID = -100500L;
    private static final Long MESSAGE_ID = 42L;
    private static final Long USER_ID = 7L;

    @Mock
    private ChatMessageService chatMessageService;

    @Mock
    private ReportFacade reportFacade;

    @Mock
    private ChatNotifier chatNotifier;

    private StepboardProperties properties;

    private ChatMessageHandler chatMessageHandler;

    @BeforeEach
    void setUp() {
        properties = new StepboardProperties();
        chatMessageHandler = new ChatMessageHandler(
            properties,
            chatMessageService,
            new ReportParser(Clock.systemUTC()),
            reportFacade,
            chatNotifier
        );
    }

    private static IncomingMessage message(String text) {
        return new IncomingMessage(MESSAGE_ID, CHAT_ID, USER_ID, "alice_tg", text, ZonedDateTime.now());
    }

    @DisplayName("보고 메시지를 처리하는 경우")
    @Nested
    class Report {
        @DisplayName("저장에 성공하면, 닉네임과 함께 접수 답장을 보낸다.")
        @Test
        void repliesAccepted_whenReportIsSaved() {
            String text = "#отчет #alice 1.5.2024 8000";
            when(reportFacade.submit(USER_ID, text))
                .thenReturn(new ReportInfo(1L, USER_ID, "alice", LocalDate.of(2024, 5, 1), 8000));

            chatMessageHandler.handle(message(text));

            verify(chatNotifier).reply(CHAT_ID, MESSAGE_ID, "#alice - принято");
        }

        @DisplayName("필수 필드가 없으면, 검증 메시지로 답장한다.")
        @Test
        void repliesValidationMessage_whenFieldIsMissing() {
            String text = "#отчет 1.5.2024 8000";
            when(reportFacade.submit(USER_ID, text))
                .thenThrow(new CoreException(ErrorType.BAD_REQUEST, ReportFacade.MISSING_NICKNAME));

            chatMessageHandler.handle(message(text));

            verify(chatNotifier).reply(CHAT_ID, MESSAGE_ID, "Отсутствует #ник");
        }

        @DisplayName("저장에 실패하면, 저장 오류로 답장한다.")
        @Test
        void repliesSaveFailed_whenStorageFails() {
            String text = "#отчет #alice 8000";
            when(reportFacade.submit(USER_ID, text)).thenThrow(new DataAccessResourceFailureException("db down"));

            chatMessageHandler.handle(message(text));

            verify(chatNotifier).reply(CHAT_ID, MESSAGE_ID, ChatMessageHandler.SAVE_FAILED);
        }

        @DisplayName("메시지 기록에 실패해도, 보고는 처리한다.")
        @Test
        void processesReport_whenHistoryRecordFails() {
            String text = "#отчет #alice 8000";
            when(chatMessageService.record(any())).thenThrow(new DataAccessResourceFailureException("db down"));
            when(reportFacade.submit(USER_ID, text))
                .thenReturn(new ReportInfo(1L, USER_ID, "alice", LocalDate.of(2024, 5, 1), 8000));

            chatMessageHandler.handle(message(text));

            verify(chatNotifier).reply(CHAT_ID, MESSAGE_ID, "#alice - принято");
        }
    }

    @DisplayName("보고가 아닌 메시지는 기록만 하고 답장하지 않는다.")
    @Test
    void recordsOnly_whenNotReport() {
        chatMessageHandler.handle(message("всем привет"));

        ArgumentCaptor<ChatMessage> captor = ArgumentCaptor.forClass(ChatMessage.class);
        verify(chatMessageService).record(captor.capture());
        assertThat(captor.getValue().getText()).isEqualTo("всем привет");
        assertThat(captor.getValue().getChatId()).isEqualTo(CHAT_ID);
        verifyNoInteractions(reportFacade, chatNotifier);
    }

    @DisplayName("허용되지 않은 채팅의 메시지는 무시한다.")
    @Test
    void ignoresMessage_whenChatIsNotAllowed() {
        properties.getChat().setAllowedChatIds(List.of(-1L));

        chatMessageHandler.handle(message("#отчет #alice 8000"));

        verifyNoInteractions(chatMessageService, reportFacade, chatNotifier);
    }

    @DisplayName("텍스트가 없는 메시지는 무시한다.")
    @Test
    void ignoresMessage_whenTextIsBlank() {
        chatMessageHandler.handle(message(" "));

        verify(chatMessageService, never()).record(any());
    }
}
