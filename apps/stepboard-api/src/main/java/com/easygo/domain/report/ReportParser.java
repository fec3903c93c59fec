package com.easygo.domain.report;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@code #отчет} 보고 메시지 파서.
 * <p>
 * 구성 요소의 순서와 무관하게 닉네임, 날짜, 걸음 수를 추출합니다.
 * <pre>
 * #отчет #nickname d.m[.yy|.yyyy] steps
 * </pre>
 * 어떤 입력에도 예외를 던지지 않으며, 찾지 못한 필드는 {@code null}로 남깁니다.
 * </p>
 *
 * <h3>추출 규칙</h3>
 * <ul>
 *   <li>닉네임: {@code #отчет}(대소문자 무시)이 아닌 첫 번째 해시태그</li>
 *   <li>날짜: 첫 번째 {@code d.m[.y]} 패턴 ({@code /} 구분자 허용, 구분자는 일관되어야 함).
 *       연도가 없으면 올해, 두 자리면 2000년대. 존재하지 않는 날짜는 버립니다.</li>
 *   <li>걸음 수: 날짜 패턴과 해시태그를 모두 지운 뒤 남은 첫 번째 정수</li>
 * </ul>
 *
 * @author EasyGo
 * @version 1.0
 */
@Component
@RequiredArgsConstructor
public class ReportParser {

    public static final String REPORT_MARKER = "отчет";

    private static final Pattern HASHTAG_PATTERN =
        Pattern.compile("#(\\w+)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern DATE_PATTERN =
        Pattern.compile("(?<!\\d)(\\d{1,2})([./])(\\d{1,2})(?:\\2(\\d{4}|\\d{2}))?(?!\\d)");

    private static final Pattern NUMBER_PATTERN = Pattern.compile("(?<!\\d)\\d+(?!\\d)");

    private final Clock clock;

    /**
     * 보고 메시지를 파싱합니다.
     *
     * @param text 원문 메시지
     * @return 추출된 후보 레코드 (항상 non-null)
     */
    public ParsedReport parse(String text) {
        if (text == null || text.isBlank()) {
            return ParsedReport.empty();
        }
        return new ParsedReport(extractNickname(text), extractDate(text), extractSteps(text));
    }

    /**
     * 메시지가 보고 마커({@code #отчет})를 포함하는지 확인합니다.
     *
     * @param text 원문 메시지
     * @return 마커 포함 여부
     */
    public boolean isReport(String text) {
        return text != null && text.toLowerCase(Locale.ROOT).contains("#" + REPORT_MARKER);
    }

    private String extractNickname(String text) {
        Matcher matcher = HASHTAG_PATTERN.matcher(text);
        while (matcher.find()) {
            String tag = matcher.group(1);
            if (!REPORT_MARKER.equals(tag.toLowerCase(Locale.ROOT))) {
                return tag;
            }
        }
        return null;
    }

    private LocalDate extractDate(String text) {
        Matcher matcher = DATE_PATTERN.matcher(text);
        if (!matcher.find()) {
            return null;
        }

        int day = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(3));
        int year = resolveYear(matcher.group(4));
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            // 32.13 같은 날짜는 버린다 (다음 매치로 넘어가지 않음)
            return null;
        }
    }

    private int resolveYear(String yearToken) {
        if (yearToken == null) {
            return LocalDate.now(clock).getYear();
        }
        int value = Integer.parseInt(yearToken);
        return yearToken.length() == 2 ? 2000 + value : value;
    }

    private Integer extractSteps(String text) {
        String cleaned = DATE_PATTERN.matcher(text).replaceAll(" ");
        cleaned = HASHTAG_PATTERN.matcher(cleaned).replaceAll(" ");

        Matcher matcher = NUMBER_PATTERN.matcher(cleaned);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group());
        } catch (NumberFormatException e) {
            // int 범위를 넘는 숫자는 걸음 수로 보지 않는다
            return null;
        }
    }
}
