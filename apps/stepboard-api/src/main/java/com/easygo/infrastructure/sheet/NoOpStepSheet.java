package com.easygo.infrastructure.sheet;

import com.easygo.domain.sheet.StepSheet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * 시트 연동이 꺼져 있을 때 사용하는 StepSheet.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "stepboard.sheets", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoOpStepSheet implements StepSheet {

    @Override
    public void writeSteps(String nickname, LocalDate date, int steps) {
        log.debug("시트 연동 비활성화, 걸음 수 기록 생략: nickname={}, date={}", nickname, date);
    }

    @Override
    public void writeMedal(String nickname, LocalDate date, String symbol) {
        log.debug("시트 연동 비활성화, 메달 기록 생략: nickname={}, date={}", nickname, date);
    }
}
