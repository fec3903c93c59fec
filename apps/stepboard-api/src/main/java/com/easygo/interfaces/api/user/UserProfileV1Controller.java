package com.easygo.interfaces.api.user;

import com.easygo.domain.user.UserProfileService;
import com.easygo.interfaces.api.ApiResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 사용자 프로필 API v1 컨트롤러.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/users")
public class UserProfileV1Controller {

    private final UserProfileService userProfileService;

    /**
     * 사용자의 저장된 닉네임을 조회합니다.
     *
     * @param userId 채팅 사용자 ID
     * @return 프로필
     * @throws CoreException 프로필이 없을 경우 (NOT_FOUND)
     */
    @GetMapping("/{userId}/profile")
    public ApiResponse<UserProfileV1Dto.ProfileResponse> getProfile(@PathVariable Long userId) {
        return ApiResponse.success(UserProfileV1Dto.ProfileResponse.from(userProfileService.getProfile(userId)));
    }
}
