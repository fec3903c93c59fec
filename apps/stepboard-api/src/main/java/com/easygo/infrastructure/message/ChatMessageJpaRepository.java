package com.easygo.infrastructure.message;

import com.easygo.domain.message.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.ZonedDateTime;

/**
 * ChatMessage 엔티티를 위한 Spring Data JPA 리포지토리.
 */
public interface ChatMessageJpaRepository extends JpaRepository<ChatMessage, Long> {

    /**
     * 기준 시각 이전 메시지를 벌크 삭제합니다.
     *
     * @param cutoff 기준 시각
     * @return 삭제된 행 수
     */
    @Modifying
    @Query("DELETE FROM ChatMessage cm WHERE cm.sentAt < :cutoff")
    int deleteAllBySentAtBefore(@Param("cutoff") ZonedDateTime cutoff);
}
