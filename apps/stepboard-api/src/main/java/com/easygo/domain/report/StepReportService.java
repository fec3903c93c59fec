package com.easygo.domain.report;

import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * 걸음 수 보고 도메인 서비스.
 * <p>
 * (nickname, reportDate) 키 기준 upsert와 일/기간 조회를 담당합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class StepReportService {
    private final StepReportRepository stepReportRepository;

    /**
     * 보고를 upsert합니다.
     * <p>
     * 같은 키의 보고가 있으면 비관적 락으로 잡고 걸음 수를 덮어쓰며, 없으면 새로 생성합니다.
     * </p>
     * <p>
     * 동시 삽입으로 유니크 제약을 위반하면 이 트랜잭션은 롤백되고 {@link DataIntegrityViolationException}이
     * 전파됩니다. 호출자는 트랜잭션 밖에서 한 번 더 호출하여 갱신 경로로 처리합니다.
     * </p>
     *
     * @param userId 사용자 ID (알 수 없으면 null)
     * @param nickname 닉네임
     * @param reportDate 보고 날짜
     * @param steps 걸음 수
     * @return 저장된 보고
     * @throws CoreException 필드가 유효하지 않을 경우
     * @throws DataIntegrityViolationException 같은 키의 보고가 동시에 삽입된 경우
     */
    @Transactional
    public StepReport upsert(Long userId, String nickname, LocalDate reportDate, Integer steps) {
        return stepReportRepository.findByNicknameAndReportDateForUpdate(nickname, reportDate)
            .map(existing -> {
                existing.overwrite(userId, steps);
                log.debug("걸음 수 보고 갱신: nickname={}, date={}, steps={}", nickname, reportDate, steps);
                return stepReportRepository.save(existing);
            })
            .orElseGet(() -> {
                StepReport created = stepReportRepository.save(StepReport.of(userId, nickname, reportDate, steps));
                log.debug("걸음 수 보고 생성: nickname={}, date={}, steps={}", nickname, reportDate, steps);
                return created;
            });
    }

    /**
     * 특정 날짜의 보고를 조회합니다.
     *
     * @param reportDate 보고 날짜
     * @return 보고 목록
     */
    @Transactional(readOnly = true)
    public List<StepReport> getDay(LocalDate reportDate) {
        return stepReportRepository.findAllByReportDate(reportDate);
    }

    /**
     * 기간 내 보고를 조회합니다.
     *
     * @param from 시작일 (포함)
     * @param to 종료일 (포함)
     * @return 보고 목록
     * @throws CoreException from이 to보다 늦을 경우
     */
    @Transactional(readOnly = true)
    public List<StepReport> getRange(LocalDate from, LocalDate to) {
        if (from.isAfter(to)) {
            throw new CoreException(ErrorType.BAD_REQUEST, "조회 시작일은 종료일보다 늦을 수 없습니다.");
        }
        return stepReportRepository.findAllByReportDateBetween(from, to);
    }
}
