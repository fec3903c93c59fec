package com.easygo.infrastructure.report;

import com.easygo.domain.report.StepReport;
import com.easygo.domain.report.StepReportRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * StepReportRepository의 JPA 구현체.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class StepReportRepositoryImpl implements StepReportRepository {
    private final StepReportJpaRepository stepReportJpaRepository;

    /**
     * {@inheritDoc}
     */
    @Override
    public StepReport save(StepReport stepReport) {
        return stepReportJpaRepository.save(stepReport);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<StepReport> findByNicknameAndReportDateForUpdate(String nickname, LocalDate reportDate) {
        return stepReportJpaRepository.findByNicknameAndReportDateForUpdate(nickname, reportDate);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<StepReport> findAllByReportDate(LocalDate reportDate) {
        return stepReportJpaRepository.findAllByReportDate(reportDate);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<StepReport> findAllByReportDateBetween(LocalDate from, LocalDate to) {
        return stepReportJpaRepository.findAllByReportDateBetweenOrderByReportDateAscNicknameAsc(from, to);
    }
}
