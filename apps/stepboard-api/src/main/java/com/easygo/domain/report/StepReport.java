package com.easygo.domain.report;

import com.easygo.domain.BaseEntity;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 하루 걸음 수 보고 엔티티.
 * <p>
 * (nickname, reportDate) 조합당 하나의 행만 존재하며,
 * 같은 키로 다시 보고하면 걸음 수를 덮어씁니다 (last-write-wins).
 * </p>
 *
 * <h3>검증 규칙</h3>
 * <ul>
 *   <li>nickname: 필수, 최대 64자</li>
 *   <li>reportDate: 필수</li>
 *   <li>steps: 0 이상</li>
 * </ul>
 *
 * @author EasyGo
 * @version 1.0
 */
@Entity
@Table(
    name = "step_report",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_step_report_nickname_date", columnNames = {"nickname", "report_date"})
    },
    indexes = {
        @Index(name = "idx_step_report_date", columnList = "report_date")
    }
)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Getter
public class StepReport extends BaseEntity {

    @Column(name = "user_id")
    private Long userId;

    @Column(name = "nickname", nullable = false, length = 64)
    private String nickname;

    @Column(name = "report_date", nullable = false)
    private LocalDate reportDate;

    @Column(name = "steps", nullable = false)
    private Integer steps;

    /**
     * 걸음 수 보고를 생성합니다.
     *
     * @param userId 보고한 사용자 ID (알 수 없으면 null)
     * @param nickname 닉네임
     * @param reportDate 보고 날짜
     * @param steps 걸음 수
     * @throws CoreException 필드가 유효하지 않을 경우
     */
    public StepReport(Long userId, String nickname, LocalDate reportDate, Integer steps) {
        validateNickname(nickname);
        validateReportDate(reportDate);
        validateSteps(steps);

        this.userId = userId;
        this.nickname = nickname;
        this.reportDate = reportDate;
        this.steps = steps;
    }

    public static StepReport of(Long userId, String nickname, LocalDate reportDate, Integer steps) {
        return new StepReport(userId, nickname, reportDate, steps);
    }

    /**
     * 같은 (nickname, reportDate)에 대한 새 보고로 걸음 수를 덮어씁니다.
     * <p>
     * 사용자 ID가 주어지면 함께 갱신합니다.
     * </p>
     *
     * @param userId 보고한 사용자 ID (null이면 기존 값 유지)
     * @param steps 새 걸음 수
     * @throws CoreException steps가 유효하지 않을 경우
     */
    public void overwrite(Long userId, Integer steps) {
        validateSteps(steps);
        if (userId != null) {
            this.userId = userId;
        }
        this.steps = steps;
    }

    private static void validateNickname(String nickname) {
        if (nickname == null || nickname.isBlank()) {
            throw new CoreException(ErrorType.BAD_REQUEST, "닉네임은 필수입니다.");
        }
        if (nickname.length() > 64) {
            throw new CoreException(ErrorType.BAD_REQUEST, "닉네임은 64자 이내여야 합니다.");
        }
    }

    private static void validateReportDate(LocalDate reportDate) {
        if (reportDate == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, "보고 날짜는 필수입니다.");
        }
    }

    private static void validateSteps(Integer steps) {
        if (steps == null || steps < 0) {
            throw new CoreException(ErrorType.BAD_REQUEST, "걸음 수는 0 이상이어야 합니다.");
        }
    }
}
