package com.easygo.domain.report;

import java.time.LocalDate;

/**
 * 보고 메시지에서 추출한 후보 레코드.
 * <p>
 * 각 필드는 메시지에 없으면 {@code null}입니다. 저장되지 않으며,
 * 필수 필드 검증은 호출자가 수행합니다.
 * </p>
 *
 * @param nickname 닉네임 ({@code #} 제외)
 * @param date 보고 날짜
 * @param steps 걸음 수
 */
public record ParsedReport(String nickname, LocalDate date, Integer steps) {

    public static ParsedReport empty() {
        return new ParsedReport(null, null, null);
    }
}
