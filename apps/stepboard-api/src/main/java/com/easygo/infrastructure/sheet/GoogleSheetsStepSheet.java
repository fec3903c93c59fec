package com.easygo.infrastructure.sheet;

import com.easygo.config.Resilience4jRetryConfig;
import com.easygo.config.StepboardProperties;
import com.easygo.domain.medal.MedalReportRenderer;
import com.easygo.domain.sheet.StepSheet;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Google Sheets 기반 StepSheet 구현체.
 * <p>
 * <b>시트 레이아웃:</b>
 * <pre>
 * Nick  | 01.05.2024 | 02.05.2024
 * alice | 12000 🥇   | 8000
 * </pre>
 * 빈 시트면 헤더를 만들고, 날짜 열이나 닉네임 행이 없으면 끝에 추가합니다.
 * </p>
 * <p>
 * 일시적 오류는 Resilience4j Retry로 재시도합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "stepboard.sheets", name = "enabled", havingValue = "true")
public class GoogleSheetsStepSheet implements StepSheet {

    static final String USER_ENTERED = "USER_ENTERED";

    private final GoogleSheetsClient googleSheetsClient;
    private final StepboardProperties properties;
    private final MedalReportRenderer medalReportRenderer;

    @Override
    @Retry(name = Resilience4jRetryConfig.GOOGLE_SHEETS)
    public void writeSteps(String nickname, LocalDate date, int steps) {
        String cell = locateCell(readGrid(), nickname, date).address();
        write(cell, steps);
        log.info("시트 걸음 수 기록: nickname={}, date={}, steps={}, cell={}", nickname, date, steps, cell);
    }

    @Override
    @Retry(name = Resilience4jRetryConfig.GOOGLE_SHEETS)
    public void writeMedal(String nickname, LocalDate date, String symbol) {
        StepSheetGrid grid = readGrid();
        CellLocation location = locateCell(grid, nickname, date);
        String current = grid.valueAt(location.row(), location.col());
        write(location.address(), medalReportRenderer.appendMedalSymbol(current, symbol));
        log.info("시트 메달 기록: nickname={}, date={}, symbol={}, cell={}", nickname, date, symbol, location.address());
    }

    private StepSheetGrid readGrid() {
        StepboardProperties.Sheets sheets = properties.getSheets();
        GoogleSheetsDto.ValueRange range = googleSheetsClient.getValues(sheets.getSpreadsheetId(), quotedWorksheet());
        return StepSheetGrid.of(range != null ? range.values() : null);
    }

    private CellLocation locateCell(StepSheetGrid grid, String nickname, LocalDate date) {
        if (grid.isEmpty()) {
            write(a1(0, 0), StepSheetGrid.NICK_HEADER);
            log.info("시트 헤더 생성: worksheet={}", worksheet());
        }

        int col = grid.findDateColumn(date);
        if (col < 0) {
            col = Math.max(grid.nextColumn(), 1);
            write(a1(0, col), date.format(StepSheetGrid.DATE_FORMATTER));
            log.debug("시트 날짜 열 추가: date={}, col={}", date, col);
        }

        int row = grid.findNicknameRow(nickname);
        if (row < 0) {
            row = Math.max(grid.nextRow(), 1);
            write(a1(row, 0), nickname);
            log.debug("시트 닉네임 행 추가: nickname={}, row={}", nickname, row);
        }
        return new CellLocation(row, col, a1(row, col));
    }

    private void write(String range, Object value) {
        googleSheetsClient.updateValues(
            properties.getSheets().getSpreadsheetId(),
            range,
            USER_ENTERED,
            GoogleSheetsDto.ValueRange.single(range, value)
        );
    }

    private String a1(int row, int col) {
        return StepSheetGrid.a1(worksheet(), row, col);
    }

    private String worksheet() {
        return properties.getSheets().getWorksheet();
    }

    private String quotedWorksheet() {
        return "'" + worksheet().replace("'", "''") + "'";
    }

    private record CellLocation(int row, int col, String address) {
    }
}
