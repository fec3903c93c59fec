package com.easygo.domain.user;

import java.util.Optional;

/**
 * UserProfile 엔티티에 대한 저장소 인터페이스.
 *
 * @author EasyGo
 * @version 1.0
 */
public interface UserProfileRepository {

    /**
     * 프로필을 저장합니다.
     *
     * @param userProfile 저장할 프로필
     * @return 저장된 프로필
     */
    UserProfile save(UserProfile userProfile);

    /**
     * 사용자 ID로 프로필을 조회합니다.
     *
     * @param userId 채팅 사용자 ID
     * @return 조회된 프로필을 담은 Optional
     */
    Optional<UserProfile> findByUserId(Long userId);

    /**
     * 사용자 ID로 프로필을 조회합니다. (비관적 락)
     *
     * @param userId 채팅 사용자 ID
     * @return 조회된 프로필을 담은 Optional
     */
    Optional<UserProfile> findByUserIdForUpdate(Long userId);
}
