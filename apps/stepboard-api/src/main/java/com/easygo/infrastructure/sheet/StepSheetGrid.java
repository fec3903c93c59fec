package com.easygo.infrastructure.sheet;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 걸음 수 시트의 메모리 상 격자.
 * <p>
 * 1행은 헤더({@code Nick | dd.MM.yyyy | ...}), 1열은 닉네임입니다.
 * 행/열 인덱스는 0부터 시작합니다.
 * </p>
 */
class StepSheetGrid {

    static final String NICK_HEADER = "Nick";
    static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    private final List<List<String>> rows;

    private StepSheetGrid(List<List<String>> rows) {
        this.rows = rows;
    }

    static StepSheetGrid of(List<List<Object>> values) {
        List<List<String>> rows = new ArrayList<>();
        if (values != null) {
            for (List<Object> row : values) {
                List<String> cells = new ArrayList<>();
                if (row != null) {
                    for (Object cell : row) {
                        cells.add(cell == null ? "" : String.valueOf(cell));
                    }
                }
                rows.add(cells);
            }
        }
        return new StepSheetGrid(rows);
    }

    boolean isEmpty() {
        return rows.isEmpty() || rows.get(0).isEmpty();
    }

    /**
     * @return 날짜 열 인덱스, 없으면 -1
     */
    int findDateColumn(LocalDate date) {
        if (rows.isEmpty()) {
            return -1;
        }
        String header = date.format(DATE_FORMATTER);
        List<String> headerRow = rows.get(0);
        for (int col = 1; col < headerRow.size(); col++) {
            if (header.equals(headerRow.get(col).strip())) {
                return col;
            }
        }
        return -1;
    }

    /**
     * 닉네임은 대소문자를 무시하고 비교합니다.
     *
     * @return 닉네임 행 인덱스, 없으면 -1
     */
    int findNicknameRow(String nickname) {
        String target = nickname.toLowerCase(Locale.ROOT);
        for (int row = 1; row < rows.size(); row++) {
            List<String> cells = rows.get(row);
            if (!cells.isEmpty() && target.equals(cells.get(0).strip().toLowerCase(Locale.ROOT))) {
                return row;
            }
        }
        return -1;
    }

    int nextColumn() {
        return rows.isEmpty() ? 0 : rows.get(0).size();
    }

    int nextRow() {
        return rows.size();
    }

    String valueAt(int row, int col) {
        if (row >= rows.size()) {
            return "";
        }
        List<String> cells = rows.get(row);
        return col < cells.size() ? cells.get(col) : "";
    }

    /**
     * 0부터 시작하는 (row, col)을 A1 표기법 셀 주소로 변환합니다.
     */
    static String a1(String worksheet, int row, int col) {
        return "'" + worksheet.replace("'", "''") + "'!" + columnLetter(col) + (row + 1);
    }

    static String columnLetter(int col) {
        StringBuilder letters = new StringBuilder();
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            letters.insert(0, (char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return letters.toString();
    }
}
