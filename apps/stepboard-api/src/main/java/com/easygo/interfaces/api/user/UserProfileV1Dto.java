package com.easygo.interfaces.api.user;

import com.easygo.domain.user.UserProfile;

/**
 * 사용자 프로필 API v1 DTO.
 */
public class UserProfileV1Dto {
    public record ProfileResponse(Long userId, String nickname) {
        public static ProfileResponse from(UserProfile profile) {
            return new ProfileResponse(profile.getUserId(), profile.getNickname());
        }
    }
}
