package com.easygo.interfaces.api.report;

import com.easygo.application.report.ReportFacade;
import com.easygo.application.report.ReportInfo;
import com.easygo.interfaces.api.ApiResponse;
import com.easygo.interfaces.api.RequestDates;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 걸음 수 보고 API v1 컨트롤러.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/reports")
public class ReportV1Controller {

    private final ReportFacade reportFacade;

    /**
     * 보고 메시지를 제출합니다.
     *
     * @param request 보고 제출 요청
     * @return 저장된 보고
     * @throws CoreException 닉네임 또는 걸음 수가 없을 경우
     */
    @PostMapping
    public ApiResponse<ReportV1Dto.ReportResponse> submit(
        @Valid @RequestBody ReportV1Dto.SubmitRequest request
    ) {
        ReportInfo info = reportFacade.submit(request.userId(), request.text());
        return ApiResponse.success(ReportV1Dto.ReportResponse.from(info));
    }

    /**
     * 기간 내 보고를 조회합니다.
     *
     * @param from 시작일 (yyyyMMdd, 포함)
     * @param to 종료일 (yyyyMMdd, 포함)
     * @return 보고 목록 (날짜, 닉네임 오름차순)
     */
    @GetMapping
    public ApiResponse<ReportV1Dto.ReportsResponse> getRange(
        @RequestParam String from,
        @RequestParam String to
    ) {
        return ApiResponse.success(ReportV1Dto.ReportsResponse.from(
            reportFacade.getRange(RequestDates.parse("from", from), RequestDates.parse("to", to))
        ));
    }

    /**
     * 특정 날짜의 보고를 조회합니다.
     *
     * @param date 날짜 (yyyyMMdd)
     * @return 보고 목록
     */
    @GetMapping("/daily")
    public ApiResponse<ReportV1Dto.ReportsResponse> getDay(@RequestParam String date) {
        return ApiResponse.success(ReportV1Dto.ReportsResponse.from(
            reportFacade.getDay(RequestDates.parse("date", date))
        ));
    }
}
