package com.easygo.application.report;

import com.easygo.domain.report.StepReport;

import java.time.LocalDate;

/**
 * 저장된 걸음 수 보고 정보.
 *
 * @param id 보고 ID
 * @param userId 사용자 ID (알 수 없으면 null)
 * @param nickname 닉네임
 * @param reportDate 보고 날짜
 * @param steps 걸음 수
 */
public record ReportInfo(Long id, Long userId, String nickname, LocalDate reportDate, Integer steps) {
    public static ReportInfo from(StepReport report) {
        return new ReportInfo(
            report.getId(),
            report.getUserId(),
            report.getNickname(),
            report.getReportDate(),
            report.getSteps()
        );
    }
}
