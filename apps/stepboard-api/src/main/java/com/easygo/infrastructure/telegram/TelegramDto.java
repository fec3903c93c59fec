package com.easygo.infrastructure.telegram;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Telegram Bot API DTO.
 */
public class TelegramDto {

    /**
     * Bot API 공통 응답.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiResponse<T>(
        @JsonProperty("ok") boolean ok,
        @JsonProperty("result") T result,
        @JsonProperty("description") String description
    ) {
    }

    /**
     * sendMessage 요청.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SendMessageRequest(
        @JsonProperty("chat_id") Long chatId,
        @JsonProperty("text") String text,
        @JsonProperty("reply_to_message_id") Long replyToMessageId
    ) {
    }

    /**
     * Webhook으로 수신하는 업데이트. 일반 메시지 또는 채널 게시물 중 하나를 가집니다.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Update(
        @JsonProperty("update_id") Long updateId,
        @JsonProperty("message") Message message,
        @JsonProperty("channel_post") Message channelPost
    ) {
        public Message effectiveMessage() {
            return message != null ? message : channelPost;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(
        @JsonProperty("message_id") Long messageId,
        @JsonProperty("from") User from,
        @JsonProperty("chat") Chat chat,
        @JsonProperty("date") Long date,
        @JsonProperty("text") String text,
        @JsonProperty("caption") String caption
    ) {
        /**
         * 본문 텍스트. 미디어 메시지는 캡션을 사용합니다.
         */
        public String effectiveText() {
            return text != null ? text : caption;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
        @JsonProperty("id") Long id,
        @JsonProperty("username") String username
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Chat(
        @JsonProperty("id") Long id,
        @JsonProperty("type") String type
    ) {
    }
}
