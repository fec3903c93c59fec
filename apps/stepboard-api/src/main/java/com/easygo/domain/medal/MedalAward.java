package com.easygo.domain.medal;

import com.easygo.domain.report.StepReport;

/**
 * 랭킹 결과 한 건: 보고와 그 보고가 받은 메달.
 *
 * @param report 걸음 수 보고
 * @param medal 부여된 메달
 */
public record MedalAward(StepReport report, Medal medal) {
}
