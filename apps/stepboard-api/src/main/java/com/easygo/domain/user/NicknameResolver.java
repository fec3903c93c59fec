package com.easygo.domain.user;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 보고에 사용할 닉네임을 결정합니다.
 * <p>
 * <b>결정 순서:</b>
 * <ol>
 *   <li>메시지에서 파싱한 닉네임이 있으면 그것을 사용하고, 사용자 ID가 있으면 프로필을 생성/동기화</li>
 *   <li>파싱한 닉네임이 없으면 사용자 ID로 저장된 프로필의 닉네임</li>
 *   <li>둘 다 없으면 null</li>
 * </ol>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class NicknameResolver {
    private final UserProfileRepository userProfileRepository;

    /**
     * 닉네임을 결정합니다.
     *
     * @param userId 채팅 사용자 ID (알 수 없으면 null)
     * @param parsedNickname 메시지에서 파싱한 닉네임 (없으면 null)
     * @return 사용할 닉네임, 결정할 수 없으면 null
     * @throws org.springframework.dao.DataIntegrityViolationException 같은 사용자의 프로필이 동시에 생성된 경우
     */
    @Transactional
    public String resolve(Long userId, String parsedNickname) {
        if (parsedNickname != null && !parsedNickname.isBlank()) {
            if (userId != null) {
                syncProfile(userId, parsedNickname);
            }
            return parsedNickname;
        }

        if (userId != null) {
            return userProfileRepository.findByUserId(userId)
                .map(UserProfile::getNickname)
                .orElse(null);
        }
        return null;
    }

    private void syncProfile(Long userId, String nickname) {
        userProfileRepository.findByUserIdForUpdate(userId)
            .ifPresentOrElse(
                profile -> {
                    if (profile.changeNickname(nickname)) {
                        userProfileRepository.save(profile);
                        log.info("닉네임 변경: userId={}, nickname={}", userId, nickname);
                    }
                },
                () -> {
                    userProfileRepository.save(UserProfile.of(userId, nickname));
                    log.info("프로필 생성: userId={}, nickname={}", userId, nickname);
                }
            );
    }
}
