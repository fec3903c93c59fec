package com.easygo.domain.sheet;

import java.time.LocalDate;

/**
 * 걸음 수 시트 (닉네임 행 × 날짜 열) 인터페이스.
 * <p>
 * 외부 스프레드시트처럼 (nickname, date) 셀 단위로 주소를 지정하는 출력 대상입니다.
 * 구현체는 행이나 열이 없으면 새로 추가해야 합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
public interface StepSheet {

    /**
     * (nickname, date) 셀에 걸음 수를 기록합니다.
     *
     * @param nickname 닉네임
     * @param date 날짜
     * @param steps 걸음 수
     */
    void writeSteps(String nickname, LocalDate date, int steps);

    /**
     * (nickname, date) 셀에 메달 기호를 붙입니다.
     * <p>
     * 이미 메달 기호가 있으면 교체하여 기호가 하나만 남도록 합니다.
     * </p>
     *
     * @param nickname 닉네임
     * @param date 날짜
     * @param symbol 메달 기호
     */
    void writeMedal(String nickname, LocalDate date, String symbol);
}
