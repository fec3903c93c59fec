package com.easygo.infrastructure.user;

import com.easygo.domain.user.UserProfile;
import com.easygo.domain.user.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * UserProfileRepository의 JPA 구현체.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class UserProfileRepositoryImpl implements UserProfileRepository {
    private final UserProfileJpaRepository userProfileJpaRepository;

    @Override
    public UserProfile save(UserProfile userProfile) {
        return userProfileJpaRepository.save(userProfile);
    }

    @Override
    public Optional<UserProfile> findByUserId(Long userId) {
        return userProfileJpaRepository.findByUserId(userId);
    }

    @Override
    public Optional<UserProfile> findByUserIdForUpdate(Long userId) {
        return userProfileJpaRepository.findByUserIdForUpdate(userId);
    }
}
