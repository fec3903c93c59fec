package com.easygo.domain.message;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * 수신한 채팅 메시지 기록.
 * <p>
 * 허용된 채팅의 모든 텍스트 메시지를 보관하며,
 * 보관 기간이 지나면 스케줄러가 삭제합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Entity
@Table(name = "chat_message", indexes = {
    @Index(name = "idx_chat_message_sent_at", columnList = "sent_at")
})
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class ChatMessage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "message_id", nullable = false)
    private Long messageId;

    @Column(name = "chat_id", nullable = false)
    private Long chatId;

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "username", length = 64)
    private String username;

    @Column(name = "message_text", nullable = false, length = 4096)
    private String text;

    @Column(name = "sent_at", nullable = false)
    private ZonedDateTime sentAt;

    /**
     * ChatMessage 인스턴스를 생성합니다.
     *
     * @param messageId 채팅 메시지 ID
     * @param chatId 채팅 ID
     * @param userId 보낸 사용자 ID (채널 게시물이면 null)
     * @param username 보낸 사용자 이름 (없으면 null)
     * @param text 메시지 본문
     * @param sentAt 전송 시각
     */
    public ChatMessage(Long messageId, Long chatId, Long userId, String username, String text, ZonedDateTime sentAt) {
        this.messageId = messageId;
        this.chatId = chatId;
        this.userId = userId;
        this.username = username;
        this.text = text;
        this.sentAt = sentAt;
    }
}
