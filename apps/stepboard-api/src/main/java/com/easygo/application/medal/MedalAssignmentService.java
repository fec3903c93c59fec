package com.easygo.application.medal;

import com.easygo.config.StepboardProperties;
import com.easygo.domain.chat.ChatNotifier;
import com.easygo.domain.medal.MedalAward;
import com.easygo.domain.medal.MedalRanking;
import com.easygo.domain.medal.MedalRecordService;
import com.easygo.domain.medal.MedalReportRenderer;
import com.easygo.domain.report.StepReport;
import com.easygo.domain.report.StepReportService;
import com.easygo.domain.sheet.StepSheet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;

/**
 * 일일 메달 배정 애플리케이션 서비스.
 * <p>
 * 하루치 보고를 조회하여 상위 3개 걸음 수에 메달을 배정하고,
 * 메달 기록 저장, 시트 셀 표시, 요약 게시를 수행합니다.
 * </p>
 * <p>
 * <b>멱등성:</b> 같은 날짜를 다시 배정하면 메달 기록은 덮어쓰이고,
 * 시트 셀의 메달 기호는 하나만 유지됩니다.
 * </p>
 * <p>
 * <b>실패 처리:</b> 한 수상자의 기록 실패가 나머지 수상자 처리를 막지 않으며,
 * 기록 저장에 실패해도 시트 표시는 시도합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MedalAssignmentService {

    private final StepReportService stepReportService;
    private final MedalRanking medalRanking;
    private final MedalRecordService medalRecordService;
    private final MedalReportRenderer medalReportRenderer;
    private final StepSheet stepSheet;
    private final ChatNotifier chatNotifier;
    private final StepboardProperties properties;

    /**
     * 특정 날짜의 메달을 배정합니다.
     *
     * @param date 메달 대상 날짜
     * @return 배정 결과
     */
    public MedalAssignmentResult assignMedals(LocalDate date) {
        List<StepReport> reports = stepReportService.getDay(date);
        if (reports.isEmpty()) {
            log.info("메달 배정 생략, 보고 없음: date={}", date);
            return MedalAssignmentResult.skipped(date);
        }

        List<MedalAward> awards = medalRanking.assign(reports);
        int failed = 0;
        for (MedalAward award : awards) {
            if (!recordAward(date, award)) {
                failed++;
            }
        }

        String summary = medalReportRenderer.render(date, awards);
        Long channelId = properties.getChat().getReportChannelId();
        if (channelId != null) {
            chatNotifier.send(channelId, summary);
        }

        log.info("메달 배정 완료: date={}, reports={}, awarded={}, failed={}",
            date, reports.size(), awards.size(), failed);
        return new MedalAssignmentResult(date, awards, failed, summary);
    }

    /**
     * 메달 기록 저장과 시트 표시는 서로 독립적으로 시도합니다.
     *
     * @return 두 작업이 모두 성공했는지 여부
     */
    private boolean recordAward(LocalDate date, MedalAward award) {
        String nickname = award.report().getNickname();
        boolean succeeded = true;
        try {
            upsertRecord(award);
        } catch (Exception e) {
            succeeded = false;
            log.error("메달 기록 저장 실패: date={}, nickname={}, medal={}", date, nickname, award.medal(), e);
        }
        try {
            stepSheet.writeMedal(nickname, date, award.medal().getSymbol());
        } catch (Exception e) {
            succeeded = false;
            log.error("메달 시트 표시 실패: date={}, nickname={}, medal={}", date, nickname, award.medal(), e);
        }
        if (succeeded) {
            log.debug("메달 기록: date={}, nickname={}, medal={}", date, nickname, award.medal());
        }
        return succeeded;
    }

    private void upsertRecord(MedalAward award) {
        try {
            medalRecordService.upsert(award);
        } catch (DataIntegrityViolationException e) {
            // 같은 날짜를 동시에 배정한 경우 다시 호출하면 갱신 경로를 탄다
            log.debug("동시 삽입 감지, 재시도: nickname={}", award.report().getNickname());
            medalRecordService.upsert(award);
        }
    }
}
