package com.easygo.domain.message;

import java.time.ZonedDateTime;

/**
 * ChatMessage 엔티티에 대한 저장소 인터페이스.
 */
public interface ChatMessageRepository {

    ChatMessage save(ChatMessage chatMessage);

    /**
     * 기준 시각 이전에 전송된 메시지를 삭제합니다.
     *
     * @param cutoff 기준 시각
     * @return 삭제된 메시지 수
     */
    long deleteAllBySentAtBefore(ZonedDateTime cutoff);
}
