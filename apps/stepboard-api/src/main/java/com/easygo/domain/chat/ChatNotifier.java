package com.easygo.domain.chat;

/**
 * 채팅으로 텍스트 메시지를 보내는 인터페이스.
 *
 * @author EasyGo
 * @version 1.0
 */
public interface ChatNotifier {

    /**
     * 특정 메시지에 답장합니다.
     *
     * @param chatId 채팅 ID
     * @param replyToMessageId 답장 대상 메시지 ID
     * @param text 본문
     */
    void reply(Long chatId, Long replyToMessageId, String text);

    /**
     * 채팅(채널)에 메시지를 게시합니다.
     *
     * @param chatId 채팅 ID
     * @param text 본문
     */
    void send(Long chatId, String text);
}
