package com.easygo.infrastructure.sheet;

import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Google Sheets API v4 FeignClient.
 * <p>
 * 범위는 A1 표기법({@code 'Sheet1'!B3})을 사용합니다.
 * </p>
 */
@FeignClient(
    name = "googleSheetsClient",
    url = "${stepboard.sheets.url}",
    path = "/v4/spreadsheets",
    configuration = GoogleSheetsClientConfig.class
)
public interface GoogleSheetsClient {

    /**
     * 범위의 값을 조회합니다.
     *
     * @param spreadsheetId 스프레드시트 ID
     * @param range A1 범위
     * @return 범위 값
     */
    @GetMapping("/{spreadsheetId}/values/{range}")
    GoogleSheetsDto.ValueRange getValues(
        @PathVariable("spreadsheetId") String spreadsheetId,
        @PathVariable("range") String range
    );

    /**
     * 범위의 값을 덮어씁니다.
     *
     * @param spreadsheetId 스프레드시트 ID
     * @param range A1 범위
     * @param valueInputOption RAW 또는 USER_ENTERED
     * @param body 기록할 값
     * @return 갱신 결과
     */
    @PutMapping("/{spreadsheetId}/values/{range}")
    GoogleSheetsDto.UpdateValuesResponse updateValues(
        @PathVariable("spreadsheetId") String spreadsheetId,
        @PathVariable("range") String range,
        @RequestParam("valueInputOption") String valueInputOption,
        @RequestBody GoogleSheetsDto.ValueRange body
    );
}
