package com.easygo.infrastructure.message;

import com.easygo.domain.message.ChatMessage;
import com.easygo.domain.message.ChatMessageRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;

/**
 * ChatMessageRepository의 JPA 구현체.
 */
@RequiredArgsConstructor
@Component
public class ChatMessageRepositoryImpl implements ChatMessageRepository {
    private final ChatMessageJpaRepository chatMessageJpaRepository;

    @Override
    public ChatMessage save(ChatMessage chatMessage) {
        return chatMessageJpaRepository.save(chatMessage);
    }

    @Override
    public long deleteAllBySentAtBefore(ZonedDateTime cutoff) {
        return chatMessageJpaRepository.deleteAllBySentAtBefore(cutoff);
    }
}
