package com.easygo.domain.medal;

import com.easygo.domain.BaseEntity;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 특정 날짜에 사용자에게 부여된 메달.
 * <p>
 * (awardDate, nickname) 조합당 하나의 행만 존재합니다.
 * 같은 날짜에 대해 메달 배정을 다시 실행하면 메달을 덮어씁니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Entity
@Table(
    name = "medal_record",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_medal_record_date_nickname", columnNames = {"award_date", "nickname"})
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class MedalRecord extends BaseEntity {

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "nickname", nullable = false, length = 64)
    private String nickname;

    @Column(name = "award_date", nullable = false)
    private LocalDate awardDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "medal_type", nullable = false, length = 10)
    private Medal medal;

    /**
     * 메달 기록을 생성합니다.
     *
     * @param userId 사용자 ID (알 수 없으면 null)
     * @param nickname 닉네임
     * @param awardDate 메달 대상 날짜
     * @param medal 메달
     * @throws CoreException 필수 값이 없을 경우
     */
    public MedalRecord(Long userId, String nickname, LocalDate awardDate, Medal medal) {
        if (nickname == null || nickname.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "닉네임은 필수입니다.");
        }
        if (awardDate == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "메달 날짜는 필수입니다.");
        }
        if (medal == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "메달 종류는 필수입니다.");
        }

        this.userId = userId;
        this.nickname = nickname;
        this.awardDate = awardDate;
        this.medal = medal;
    }

    public static MedalRecord of(Long userId, String nickname, LocalDate awardDate, Medal medal) {
        return new MedalRecord(userId, nickname, awardDate, medal);
    }

    /**
     * 재배정 결과로 메달을 덮어씁니다.
     *
     * @param userId 사용자 ID (null이면 기존 값 유지)
     * @param medal 새 메달
     */
    public void reassign(Long userId, Medal medal) {
        if (medal == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "메달 종류는 필수입니다.");
        }
        if (userId != null) {
            this.userId = userId;
        }
        this.medal = medal;
    }
}
