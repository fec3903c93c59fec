package com.easygo.infrastructure.scheduler;

import com.easygo.config.StepboardProperties;
import com.easygo.domain.message.ChatMessageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZonedDateTime;

/**
 * 보관 기간이 지난 채팅 메시지 기록을 삭제하는 스케줄러.
 * <p>
 * 기본값은 매시 정각 실행, 보관 기간 24시간입니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatMessagePurgeScheduler {

    private final ChatMessageService chatMessageService;
    private final StepboardProperties properties;
    private final Clock clock;

    @Scheduled(cron = "${stepboard.chat.purge-cron}")
    public void purgeExpiredMessages() {
        ZonedDateTime cutoff = ZonedDateTime.now(clock).minus(properties.getChat().getHistoryRetention());
        try {
            long deleted = chatMessageService.purgeBefore(cutoff);
            log.info("만료 메시지 삭제 완료: cutoff={}, deleted={}", cutoff, deleted);
        } catch (Exception e) {
            log.warn("만료 메시지 삭제 실패: cutoff={}", cutoff, e);
            // 다음 스케줄에서 재시도
        }
    }
}
