package com.easygo.interfaces.api.medal;

import com.easygo.application.medal.MedalAssignmentResult;
import com.easygo.domain.medal.MedalAward;
import com.easygo.domain.medal.MedalRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * 메달 API v1의 데이터 전송 객체(DTO) 컨테이너.
 *
 * @author EasyGo
 * @version 1.0
 */
public class MedalV1Dto {
    /**
     * 메달 항목 응답 데이터.
     *
     * @param nickname 닉네임
     * @param medal 메달 (GOLD, SILVER, BRONZE)
     * @param symbol 메달 기호
     * @param steps 걸음 수 (조회 응답에서는 null)
     */
    public record MedalItemResponse(String nickname, String medal, String symbol, Integer steps) {
        public static MedalItemResponse from(MedalRecord record) {
            return new MedalItemResponse(
                record.getNickname(),
                record.getMedal().name(),
                record.getMedal().getSymbol(),
                null
            );
        }

        public static MedalItemResponse from(MedalAward award) {
            return new MedalItemResponse(
                award.report().getNickname(),
                award.medal().name(),
                award.medal().getSymbol(),
                award.report().getSteps()
            );
        }
    }

    /**
     * 날짜별 메달 조회 응답 데이터.
     */
    public record MedalsResponse(LocalDate date, List<MedalItemResponse> medals) {
        public static MedalsResponse from(LocalDate date, List<MedalRecord> records) {
            return new MedalsResponse(date, records.stream().map(MedalItemResponse::from).toList());
        }
    }

    /**
     * 메달 배정 응답 데이터.
     *
     * @param date 메달 대상 날짜
     * @param skipped 보고가 없어 배정을 생략했는지 여부
     * @param failedCount 기록에 실패한 수상자 수
     * @param summary 요약 텍스트
     * @param medals 배정된 메달 목록
     */
    public record AssignmentResponse(
        LocalDate date,
        boolean skipped,
        int failedCount,
        String summary,
        List<MedalItemResponse> medals
    ) {
        public static AssignmentResponse from(MedalAssignmentResult result) {
            return new AssignmentResponse(
                result.date(),
                result.isSkipped(),
                result.failedCount(),
                result.summary(),
                result.awards().stream().map(MedalItemResponse::from).toList()
            );
        }
    }
}
