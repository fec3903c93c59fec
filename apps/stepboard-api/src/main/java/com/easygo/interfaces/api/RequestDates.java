package com.easygo.interfaces.api;

import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * API 날짜 파라미터(yyyyMMdd) 파싱 유틸리티.
 */
public final class RequestDates {

    public static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyyMMdd");

    private RequestDates() {
    }

    /**
     * 날짜 문자열을 LocalDate로 파싱합니다.
     *
     * @param name 파라미터 이름 (오류 메시지용)
     * @param value 날짜 문자열 (yyyyMMdd 형식)
     * @return 파싱된 날짜
     * @throws CoreException 형식이 올바르지 않을 경우 (BAD_REQUEST)
     */
    public static LocalDate parse(String name, String value) {
        try {
            return LocalDate.parse(value, DATE_FORMATTER);
        } catch (DateTimeParseException e) {
            throw new CoreException(ErrorType.BAD_REQUEST,
                String.format("'%s' 날짜 형식이 올바르지 않습니다. (yyyyMMdd): %s", name, value));
        }
    }
}
