package com.easygo.infrastructure.sheet;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Google Sheets API v4 DTO.
 */
public class GoogleSheetsDto {

    /**
     * 셀 범위 값. 빈 시트는 {@code values}가 없을 수 있습니다.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValueRange(
        @JsonProperty("range") String range,
        @JsonProperty("majorDimension") String majorDimension,
        @JsonProperty("values") List<List<Object>> values
    ) {
        public static ValueRange single(String range, Object value) {
            return new ValueRange(range, "ROWS", List.of(List.of(value)));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record UpdateValuesResponse(
        @JsonProperty("spreadsheetId") String spreadsheetId,
        @JsonProperty("updatedRange") String updatedRange,
        @JsonProperty("updatedCells") Integer updatedCells
    ) {
    }
}
