package com.easygo.domain.report;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertAll;

public class ReportParserTest {

    private static final Clock FIXED_CLOCK =
        Clock.fixed(Instant.parse("2025-06-10T09:00:00Z"), ZoneId.of("Europe/Moscow"));

    private final ReportParser reportParser = new ReportParser(FIXED_CLOCK);

    static Stream<Arguments> datedReports() {
        return Stream.of(
            Arguments.of("#отчет #u 31.12.2024 1000", LocalDate.of(2024, 12, 31)),
            Arguments.of("#отчет #u 01.05.2024 1000", LocalDate.of(2024, 5, 1)),
            Arguments.of("#отчет #u 31.12.24 1000", LocalDate.of(2024, 12, 31)),
            Arguments.of("#отчет #u 01.05.24 1000", LocalDate.of(2024, 5, 1)),
            Arguments.of("#отчет #u 1.5.2024 1000", LocalDate.of(2024, 5, 1)),
            Arguments.of("#отчет #u 1.5.24 1000", LocalDate.of(2024, 5, 1)),
            Arguments.of("#отчет #u 9.3.2024 1000", LocalDate.of(2024, 3, 9)),
            Arguments.of("#отчет #u 9/3/2024 1000", LocalDate.of(2024, 3, 9))
        );
    }

    static Stream<Arguments> yearlessReports() {
        return Stream.of(
            Arguments.of("#отчет #u 15.08 8000", LocalDate.of(2025, 8, 15)),
            Arguments.of("#отчет #u 5.3 8000", LocalDate.of(2025, 3, 5))
        );
    }

    @DisplayName("닉네임 추출")
    @Nested
    class Nickname {
        @DisplayName("#отчет이 아닌 첫 해시태그를 닉네임으로 추출한다.")
        @Test
        void extractsFirstNonMarkerHashtag() {
            ParsedReport result = reportParser.parse("#отчет #alice 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("alice");
        }

        @DisplayName("닉네임 해시태그가 없으면, null을 반환한다.")
        @Test
        void returnsNull_whenNicknameIsMissing() {
            ParsedReport result = reportParser.parse("#отчет 1.5.2024 8000");

            assertThat(result.nickname()).isNull();
        }

        @DisplayName("마커는 대소문자를 무시하고, 닉네임의 대소문자는 유지한다.")
        @Test
        void ignoresMarkerCase_andPreservesNicknameCase() {
            ParsedReport result = reportParser.parse("#Отчет #Bob 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("Bob");
        }

        @DisplayName("닉네임이 마커보다 앞에 있어도 추출한다.")
        @Test
        void extractsNickname_whenItPrecedesMarker() {
            ParsedReport result = reportParser.parse("#alice #отчет 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("alice");
        }

        @DisplayName("키릴 문자 닉네임도 추출한다.")
        @Test
        void extractsCyrillicNickname() {
            ParsedReport result = reportParser.parse("#отчет #Маша 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("Маша");
        }
    }

    @DisplayName("날짜 추출")
    @Nested
    class Date {
        @DisplayName("d.m.yyyy, d.m.yy 형식의 날짜를 추출한다.")
        @ParameterizedTest
        @MethodSource("com.easygo.domain.report.ReportParserTest#datedReports")
        void extractsDate(String text, LocalDate expected) {
            ParsedReport result = reportParser.parse(text);

            assertThat(result.date()).isEqualTo(expected);
        }

        @DisplayName("연도가 없으면, 시계 기준 올해로 보완한다.")
        @ParameterizedTest
        @MethodSource("com.easygo.domain.report.ReportParserTest#yearlessReports")
        void usesCurrentYear_whenYearIsMissing(String text, LocalDate expected) {
            ParsedReport result = reportParser.parse(text);

            assertThat(result.date()).isEqualTo(expected);
        }

        @DisplayName("날짜가 없으면, null을 반환한다.")
        @Test
        void returnsNull_whenDateIsMissing() {
            ParsedReport result = reportParser.parse("#отчет #alice 8000");

            assertThat(result.date()).isNull();
        }

        @DisplayName("존재하지 않는 날짜는 버리고, 걸음 수 추출에는 영향을 주지 않는다.")
        @Test
        void discardsInvalidDate() {
            ParsedReport result = reportParser.parse("#отчет #u 32.13.2024 8000");

            assertThat(result.date()).isNull();
            assertThat(result.steps()).isEqualTo(8000);
        }

        @DisplayName("구분자가 섞인 토큰은 연도를 포함하지 않는다.")
        @Test
        void requiresConsistentSeparators() {
            ParsedReport result = reportParser.parse("#отчет #u 1.5/2024 8000");

            assertThat(result.date()).isEqualTo(LocalDate.of(2025, 5, 1));
        }
    }

    @DisplayName("걸음 수 추출")
    @Nested
    class Steps {
        @DisplayName("날짜를 제외한 첫 정수를 걸음 수로 추출한다.")
        @Test
        void extractsSteps() {
            ParsedReport result = reportParser.parse("#отчет #alice 1.5.2024 8000");

            assertThat(result.steps()).isEqualTo(8000);
        }

        @DisplayName("숫자가 없으면, null을 반환한다.")
        @Test
        void returnsNull_whenStepsAreMissing() {
            ParsedReport result = reportParser.parse("#отчет #alice 1.5.2024");

            assertThat(result.steps()).isNull();
        }

        @DisplayName("날짜의 숫자를 걸음 수로 혼동하지 않는다.")
        @Test
        void doesNotConfuseDateDigits() {
            ParsedReport result = reportParser.parse("#отчет #alice 5.3.2024 12345");

            assertThat(result.steps()).isEqualTo(12345);
        }

        @DisplayName("점 뒤에 붙은 날짜도 날짜로 인식하고, 그 숫자를 걸음 수로 쓰지 않는다.")
        @Test
        void isolatesDateDigits_whenDateFollowsDot() {
            ParsedReport result = reportParser.parse("#отчет #alice x.1.5.2024 8000");

            assertAll(
                () -> assertThat(result.date()).isEqualTo(LocalDate.of(2024, 5, 1)),
                () -> assertThat(result.steps()).isEqualTo(8000)
            );
        }

        @DisplayName("날짜가 없어도 걸음 수를 추출한다.")
        @Test
        void extractsSteps_whenDateIsMissing() {
            ParsedReport result = reportParser.parse("#отчет #alice 7500");

            assertThat(result.steps()).isEqualTo(7500);
        }

        @DisplayName("해시태그 안의 숫자는 걸음 수로 보지 않는다.")
        @Test
        void ignoresDigitsInsideHashtags() {
            ParsedReport result = reportParser.parse("#отчет #runner42 1.5.2024 25000");

            assertThat(result.nickname()).isEqualTo("runner42");
            assertThat(result.steps()).isEqualTo(25000);
        }

        @DisplayName("int 범위를 넘는 숫자는 null을 반환한다.")
        @Test
        void returnsNull_whenNumberOverflows() {
            ParsedReport result = reportParser.parse("#отчет #alice 99999999999");

            assertThat(result.steps()).isNull();
        }
    }

    @DisplayName("구성 요소 순서와 무관하게 같은 결과를 추출한다.")
    @ParameterizedTest
    @ValueSource(strings = {
        "#отчет #alice 1.5.2024 8000",
        "#alice #отчет 1.5.2024 8000",
        "8000 #отчет #alice 1.5.2024",
        "1.5.2024 8000 #отчет #alice",
        "#отчет 8000 1.5.2024 #alice"
    })
    void isOrderIndependent(String text) {
        ParsedReport result = reportParser.parse(text);

        assertThat(result).isEqualTo(new ParsedReport("alice", LocalDate.of(2024, 5, 1), 8000));
    }

    @DisplayName("마커만 있으면, 모든 필드가 null이다.")
    @Test
    void returnsEmpty_whenOnlyMarker() {
        assertThat(reportParser.parse("#отчет")).isEqualTo(ParsedReport.empty());
    }

    @DisplayName("빈 입력이면, 모든 필드가 null이다.")
    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void returnsEmpty_whenInputIsBlank(String text) {
        assertThat(reportParser.parse(text)).isEqualTo(ParsedReport.empty());
    }

    @DisplayName("보고 마커 포함 여부")
    @Nested
    class IsReport {
        @DisplayName("#отчет을 대소문자 무시하고 포함하면, true를 반환한다.")
        @ParameterizedTest
        @ValueSource(strings = {"#отчет #alice 8000", "#ОТЧЕТ #bob", "привет #Отчет"})
        void returnsTrue_whenMarkerIsPresent(String text) {
            assertThat(reportParser.isReport(text)).isTrue();
        }

        @DisplayName("마커가 없으면, false를 반환한다.")
        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"отчет #alice 8000", "#alice 8000"})
        void returnsFalse_whenMarkerIsAbsent(String text) {
            assertThat(reportParser.isReport(text)).isFalse();
        }
    }
}
