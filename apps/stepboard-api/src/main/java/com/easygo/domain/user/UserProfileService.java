package com.easygo.domain.user;

import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자 프로필 조회 서비스.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class UserProfileService {
    private final UserProfileRepository userProfileRepository;

    /**
     * 사용자 ID로 프로필을 조회합니다.
     *
     * @param userId 채팅 사용자 ID
     * @return 조회된 프로필
     * @throws CoreException 프로필이 없을 경우
     */
    @Transactional(readOnly = true)
    public UserProfile getProfile(Long userId) {
        return userProfileRepository.findByUserId(userId)
            .orElseThrow(() -> new CoreException(ErrorType.NOT_FOUND, "프로필을 찾을 수 없습니다: " + userId));
    }
}
