package com.easygo.domain.report;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * StepReport 엔티티에 대한 저장소 인터페이스.
 * <p>
 * (nickname, reportDate) 유니크 제약은 저장소 구현이 보장해야 합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
public interface StepReportRepository {

    /**
     * 보고를 저장합니다.
     *
     * @param stepReport 저장할 보고
     * @return 저장된 보고
     */
    StepReport save(StepReport stepReport);

    /**
     * 닉네임과 날짜로 보고를 조회합니다. (비관적 락)
     * <p>
     * upsert 시 동시성 제어를 위해 사용합니다.
     * </p>
     *
     * @param nickname 닉네임
     * @param reportDate 보고 날짜
     * @return 조회된 보고를 담은 Optional
     */
    Optional<StepReport> findByNicknameAndReportDateForUpdate(String nickname, LocalDate reportDate);

    /**
     * 특정 날짜의 모든 보고를 조회합니다.
     *
     * @param reportDate 보고 날짜
     * @return 보고 목록
     */
    List<StepReport> findAllByReportDate(LocalDate reportDate);

    /**
     * 기간 내 모든 보고를 조회합니다. (양 끝 포함)
     *
     * @param from 시작일
     * @param to 종료일
     * @return 보고 목록 (날짜, 닉네임 오름차순)
     */
    List<StepReport> findAllByReportDateBetween(LocalDate from, LocalDate to);
}
