package com.easygo.domain.message;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;

/**
 * 채팅 메시지 기록 서비스.
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ChatMessageService {
    private final ChatMessageRepository chatMessageRepository;

    /**
     * 수신 메시지를 기록합니다.
     *
     * @param chatMessage 수신 메시지
     * @return 저장된 메시지
     */
    @Transactional
    public ChatMessage record(ChatMessage chatMessage) {
        return chatMessageRepository.save(chatMessage);
    }

    /**
     * 기준 시각 이전의 메시지를 삭제합니다.
     *
     * @param cutoff 기준 시각
     * @return 삭제된 메시지 수
     */
    @Transactional
    public long purgeBefore(ZonedDateTime cutoff) {
        long deleted = chatMessageRepository.deleteAllBySentAtBefore(cutoff);
        log.debug("만료 메시지 삭제: cutoff={}, deleted={}", cutoff, deleted);
        return deleted;
    }
}
