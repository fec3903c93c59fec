package com.easygo.application.medal;

import com.easygo.domain.medal.MedalAward;

import java.time.LocalDate;
import java.util.List;

/**
 * 메달 배정 결과.
 *
 * @param date 메달 대상 날짜
 * @param awards 배정된 메달 목록
 * @param failedCount 기록에 실패한 수상자 수
 * @param summary 요약 텍스트 (보고가 없으면 null)
 */
public record MedalAssignmentResult(LocalDate date, List<MedalAward> awards, int failedCount, String summary) {
    public static MedalAssignmentResult skipped(LocalDate date) {
        return new MedalAssignmentResult(date, List.of(), 0, null);
    }

    public boolean isSkipped() {
        return summary == null;
    }
}
