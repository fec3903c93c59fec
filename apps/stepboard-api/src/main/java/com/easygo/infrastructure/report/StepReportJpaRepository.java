package com.easygo.infrastructure.report;

import com.easygo.domain.report.StepReport;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * StepReport 엔티티를 위한 Spring Data JPA 리포지토리.
 *
 * @author EasyGo
 * @version 1.0
 */
public interface StepReportJpaRepository extends JpaRepository<StepReport, Long> {

    /**
     * 닉네임과 날짜로 보고를 조회합니다. (비관적 락)
     * <p>
     * UNIQUE(nickname, report_date) 인덱스 기반 조회이므로 해당 행만 잠급니다.
     * </p>
     *
     * @param nickname 닉네임
     * @param reportDate 보고 날짜
     * @return 조회된 보고를 담은 Optional
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT sr FROM StepReport sr WHERE sr.nickname = :nickname AND sr.reportDate = :reportDate")
    Optional<StepReport> findByNicknameAndReportDateForUpdate(
        @Param("nickname") String nickname,
        @Param("reportDate") LocalDate reportDate
    );

    List<StepReport> findAllByReportDate(LocalDate reportDate);

    List<StepReport> findAllByReportDateBetweenOrderByReportDateAscNicknameAsc(LocalDate from, LocalDate to);
}
