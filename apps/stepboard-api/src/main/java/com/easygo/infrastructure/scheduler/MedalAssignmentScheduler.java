package com.easygo.infrastructure.scheduler;

import com.easygo.application.medal.MedalAssignmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * 일일 메달 배정 스케줄러.
 * <p>
 * 기준 시간대의 어제 보고를 집계하여 메달을 배정합니다.
 * </p>
 * <p>
 * <b>실행 시점:</b>
 * <ul>
 *   <li>기본값: 매일 17:00 UTC (모스크바 20:00)</li>
 *   <li>{@code stepboard.medal.cron}으로 변경 가능, {@code -}이면 비활성화</li>
 * </ul>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MedalAssignmentScheduler {

    private final MedalAssignmentService medalAssignmentService;
    private final Clock clock;

    @Scheduled(cron = "${stepboard.medal.cron}", zone = "UTC")
    public void assignYesterdayMedals() {
        LocalDate yesterday = LocalDate.now(clock).minusDays(1);
        try {
            medalAssignmentService.assignMedals(yesterday);
        } catch (org.springframework.dao.DataAccessException e) {
            log.warn("DB 장애로 인한 메달 배정 실패: date={}, error={}", yesterday, e.getMessage());
            // 수동 배정 API로 재실행 가능
        } catch (Exception e) {
            log.warn("메달 배정 실패: date={}", yesterday, e);
        }
    }
}
