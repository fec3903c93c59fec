package com.easygo.interfaces.api.medal;

import com.easygo.application.medal.MedalAssignmentService;
import com.easygo.domain.medal.MedalRecordService;
import com.easygo.interfaces.api.ApiResponse;
import com.easygo.interfaces.api.RequestDates;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * 메달 API v1 컨트롤러.
 * <p>
 * 날짜별 메달 조회와 수동 메달 배정을 제공합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/medals")
public class MedalV1Controller {

    private final MedalRecordService medalRecordService;
    private final MedalAssignmentService medalAssignmentService;

    /**
     * 특정 날짜의 메달을 조회합니다.
     *
     * @param date 날짜 (yyyyMMdd)
     * @return 메달 목록 (GOLD → BRONZE)
     */
    @GetMapping
    public ApiResponse<MedalV1Dto.MedalsResponse> getMedals(@RequestParam String date) {
        LocalDate targetDate = RequestDates.parse("date", date);
        return ApiResponse.success(MedalV1Dto.MedalsResponse.from(targetDate, medalRecordService.getMedals(targetDate)));
    }

    /**
     * 특정 날짜의 메달을 배정합니다. 일일 스케줄러와 같은 작업을 수행합니다.
     *
     * @param date 날짜 (yyyyMMdd)
     * @return 배정 결과
     */
    @PostMapping("/assign")
    public ApiResponse<MedalV1Dto.AssignmentResponse> assign(@RequestParam String date) {
        LocalDate targetDate = RequestDates.parse("date", date);
        return ApiResponse.success(MedalV1Dto.AssignmentResponse.from(medalAssignmentService.assignMedals(targetDate)));
    }
}
