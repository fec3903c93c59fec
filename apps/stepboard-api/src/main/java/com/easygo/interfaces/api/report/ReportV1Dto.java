package com.easygo.interfaces.api.report;

import com.easygo.application.report.ReportInfo;
import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;
import java.util.List;

/**
 * 걸음 수 보고 API v1의 데이터 전송 객체(DTO) 컨테이너.
 *
 * @author EasyGo
 * @version 1.0
 */
public class ReportV1Dto {
    /**
     * 보고 제출 요청 데이터.
     *
     * @param userId 보낸 사용자 ID (선택)
     * @param text 보고 메시지 원문 ({@code #отчет #nick 1.5.2024 8000})
     */
    public record SubmitRequest(
        Long userId,
        @NotBlank(message = "보고 메시지는 필수입니다.")
        String text
    ) {
    }

    /**
     * 보고 응답 데이터.
     */
    public record ReportResponse(Long id, Long userId, String nickname, LocalDate reportDate, Integer steps) {
        public static ReportResponse from(ReportInfo info) {
            return new ReportResponse(info.id(), info.userId(), info.nickname(), info.reportDate(), info.steps());
        }
    }

    /**
     * 보고 목록 응답 데이터.
     */
    public record ReportsResponse(List<ReportResponse> reports) {
        public static ReportsResponse from(List<ReportInfo> infos) {
            return new ReportsResponse(infos.stream().map(ReportResponse::from).toList());
        }
    }
}
