package com.easygo.infrastructure.user;

import com.easygo.domain.user.UserProfile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

/**
 * UserProfile 엔티티를 위한 Spring Data JPA 리포지토리.
 *
 * @author EasyGo
 * @version 1.0
 */
public interface UserProfileJpaRepository extends JpaRepository<UserProfile, Long> {

    Optional<UserProfile> findByUserId(Long userId);

    /**
     * 사용자 ID로 프로필을 조회합니다. (비관적 락)
     *
     * @param userId 채팅 사용자 ID
     * @return 조회된 프로필을 담은 Optional
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT up FROM UserProfile up WHERE up.userId = :userId")
    Optional<UserProfile> findByUserIdForUpdate(@Param("userId") Long userId);
}
