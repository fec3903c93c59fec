package com.easygo.application.chat;

import java.time.ZonedDateTime;

/**
 * 수신한 채팅 메시지.
 *
 * @param messageId 메시지 ID
 * @param chatId 채팅 ID
 * @param userId 보낸 사용자 ID (채널 게시물이면 null)
 * @param username 보낸 사용자 이름 (없으면 null)
 * @param text 본문 (캡션 포함)
 * @param sentAt 전송 시각
 */
public record IncomingMessage(
    Long messageId,
    Long chatId,
    Long userId,
    String username,
    String text,
    ZonedDateTime sentAt
) {
}
