package com.easygo.domain.user;

import com.easygo.domain.BaseEntity;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 사용자별 보고 닉네임 프로필.
 * <p>
 * 채팅 사용자 ID당 하나만 존재하며, 메시지에 닉네임 없이 보고해도
 * 마지막으로 사용한 닉네임을 찾을 수 있게 해 줍니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Entity
@Table(name = "user_profile")
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class UserProfile extends BaseEntity {

    @Column(name = "user_id", unique = true, nullable = false)
    private Long userId;

    @Column(name = "nickname", nullable = false, length = 64)
    private String nickname;

    /**
     * 프로필을 생성합니다.
     *
     * @param userId 채팅 사용자 ID
     * @param nickname 닉네임
     * @throws CoreException userId 또는 nickname이 없을 경우
     */
    public UserProfile(Long userId, String nickname) {
        if (userId == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "사용자 ID는 필수입니다.");
        }
        validateNickname(nickname);

        this.userId = userId;
        this.nickname = nickname;
    }

    public static UserProfile of(Long userId, String nickname) {
        return new UserProfile(userId, nickname);
    }

    /**
     * 닉네임을 변경합니다.
     *
     * @param nickname 새 닉네임
     * @return 실제로 변경되었으면 true, 기존과 같으면 false
     * @throws CoreException nickname이 비어 있을 경우
     */
    public boolean changeNickname(String nickname) {
        validateNickname(nickname);
        if (this.nickname.equals(nickname)) {
            return false;
        }
        this.nickname = nickname;
        return true;
    }

    private static void validateNickname(String nickname) {
        if (nickname == null || nickname.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "닉네임은 필수입니다.");
        }
    }
}
