package com.easygo.application.report;

import com.easygo.domain.report.ParsedReport;
import com.easygo.domain.report.ReportParser;
import com.easygo.domain.report.StepReport;
import com.easygo.domain.report.StepReportService;
import com.easygo.domain.sheet.StepSheet;
import com.easygo.domain.user.NicknameResolver;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * 걸음 수 보고 파사드.
 * <p>
 * 보고 메시지 파싱 → 닉네임 결정 → 검증 → 저장 → 시트 반영 유즈케이스를 처리합니다.
 * </p>
 * <p>
 * <b>저장 기준:</b>
 * <ul>
 *   <li>DB가 원본이며, 시트는 보조 출력입니다. 시트 기록 실패는 보고를 실패시키지 않습니다.</li>
 *   <li>날짜가 없으면 기준 시간대의 오늘 날짜를 사용합니다.</li>
 * </ul>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ReportFacade {

    public static final String MISSING_NICKNAME = "Отсутствует #ник";
    public static final String MISSING_STEPS = "Отсутствует количество шагов";

    private final ReportParser reportParser;
    private final NicknameResolver nicknameResolver;
    private final StepReportService stepReportService;
    private final StepSheet stepSheet;
    private final Clock clock;

    /**
     * 보고 메시지를 처리합니다.
     *
     * @param userId 보낸 사용자 ID (알 수 없으면 null)
     * @param text 보고 메시지 원문
     * @return 저장된 보고 정보
     * @throws CoreException 닉네임 또는 걸음 수가 없을 경우 (BAD_REQUEST)
     */
    public ReportInfo submit(Long userId, String text) {
        ParsedReport parsed = reportParser.parse(text);

        String nickname = resolveNickname(userId, parsed.nickname());
        if (nickname == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, MISSING_NICKNAME);
        }
        if (parsed.steps() == null) {
            throw new CoreException(ErrorType.BAD_REQUEST, MISSING_STEPS);
        }
        LocalDate reportDate = parsed.date() != null ? parsed.date() : LocalDate.now(clock);

        StepReport saved = upsert(userId, nickname, reportDate, parsed.steps());
        log.info("걸음 수 보고 저장: userId={}, nickname={}, date={}, steps={}",
            userId, nickname, reportDate, parsed.steps());

        try {
            stepSheet.writeSteps(nickname, reportDate, parsed.steps());
        } catch (Exception e) {
            log.warn("시트 걸음 수 기록 실패 (보고는 저장됨): nickname={}, date={}", nickname, reportDate, e);
        }
        return ReportInfo.from(saved);
    }

    /**
     * 특정 날짜의 보고를 조회합니다.
     */
    public List<ReportInfo> getDay(LocalDate date) {
        return stepReportService.getDay(date).stream()
            .map(ReportInfo::from)
            .toList();
    }

    /**
     * 기간 내 보고를 조회합니다.
     */
    public List<ReportInfo> getRange(LocalDate from, LocalDate to) {
        return stepReportService.getRange(from, to).stream()
            .map(ReportInfo::from)
            .toList();
    }

    private StepReport upsert(Long userId, String nickname, LocalDate reportDate, Integer steps) {
        try {
            return stepReportService.upsert(userId, nickname, reportDate, steps);
        } catch (DataIntegrityViolationException e) {
            // 동시 삽입으로 롤백된 경우 다시 호출하면 갱신 경로를 탄다
            log.debug("동시 삽입 감지, 재시도: nickname={}, date={}", nickname, reportDate);
            return stepReportService.upsert(userId, nickname, reportDate, steps);
        }
    }

    private String resolveNickname(Long userId, String parsedNickname) {
        try {
            return resolveWithRetry(userId, parsedNickname);
        } catch (DataAccessException e) {
            // 프로필 저장소 장애 시에도 메시지에 닉네임이 있으면 보고는 받는다
            log.warn("닉네임 결정 실패, 파싱된 닉네임 사용: userId={}, nickname={}", userId, parsedNickname, e);
            return parsedNickname;
        }
    }

    private String resolveWithRetry(Long userId, String parsedNickname) {
        try {
            return nicknameResolver.resolve(userId, parsedNickname);
        } catch (DataIntegrityViolationException e) {
            log.debug("프로필 동시 생성 감지, 재시도: userId={}", userId);
            return nicknameResolver.resolve(userId, parsedNickname);
        }
    }
}
