package com.easygo.domain.medal;

import com.easygo.domain.report.StepReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * 메달 기록 도메인 서비스.
 * <p>
 * (awardDate, nickname) 키 기준으로 메달 기록을 upsert합니다.
 * 같은 날짜를 다시 배정해도 행이 중복되지 않습니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class MedalRecordService {
    private final MedalRecordRepository medalRecordRepository;

    /**
     * 수상 결과를 메달 기록으로 upsert합니다.
     * <p>
     * 동시 삽입으로 유니크 제약을 위반하면 {@link DataIntegrityViolationException}이 전파되며,
     * 호출자가 다시 호출하면 갱신 경로로 처리됩니다.
     * </p>
     *
     * @param award 수상 결과
     * @return 저장된 메달 기록
     * @throws DataIntegrityViolationException 같은 키의 기록이 동시에 삽입된 경우
     */
    @Transactional
    public MedalRecord upsert(MedalAward award) {
        StepReport report = award.report();
        return medalRecordRepository.findByAwardDateAndNicknameForUpdate(report.getReportDate(), report.getNickname())
            .map(existing -> {
                existing.reassign(report.getUserId(), award.medal());
                return medalRecordRepository.save(existing);
            })
            .orElseGet(() -> medalRecordRepository.save(MedalRecord.of(
                report.getUserId(), report.getNickname(), report.getReportDate(), award.medal())));
    }

    /**
     * 특정 날짜의 메달 기록을 조회합니다.
     *
     * @param awardDate 메달 대상 날짜
     * @return 메달 기록 목록 (GOLD → BRONZE, 같은 메달은 닉네임 오름차순)
     */
    @Transactional(readOnly = true)
    public List<MedalRecord> getMedals(LocalDate awardDate) {
        return medalRecordRepository.findAllByAwardDate(awardDate).stream()
            .sorted(Comparator.comparing(MedalRecord::getMedal).thenComparing(MedalRecord::getNickname))
            .toList();
    }
}
