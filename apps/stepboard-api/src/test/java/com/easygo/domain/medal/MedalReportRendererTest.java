package com.easygo.domain.medal;

import com.easygo.domain.report.StepReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class MedalReportRendererTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 1);

    private final MedalReportRenderer renderer = new MedalReportRenderer();

    private static MedalAward award(String nickname, int steps, Medal medal) {
        return new MedalAward(StepReport.of(null, nickname, DATE, steps), medal);
    }

    @DisplayName("요약 메시지 생성")
    @Nested
    class Render {
        @DisplayName("메달별로 한 줄씩, 동률 닉네임을 묶어 출력한다.")
        @Test
        void rendersOneLinePerMedal() {
            List<MedalAward> awards = List.of(
                award("alice", 12000, Medal.GOLD),
                award("bob", 12000, Medal.GOLD),
                award("carol", 9000, Medal.SILVER),
                award("dave", 800, Medal.BRONZE)
            );

            String result = renderer.render(DATE, awards);

            assertThat(result).isEqualTo(String.join("\n",
                "Медали за 01.05.2024:",
                "🥇 #alice, #bob — 12 000 шагов",
                "🥈 #carol — 9 000 шагов",
                "🥉 #dave — 800 шагов"
            ));
        }

        @DisplayName("없는 메달은 줄을 만들지 않는다.")
        @Test
        void skipsMissingMedals() {
            String result = renderer.render(DATE, List.of(award("alice", 1234567, Medal.GOLD)));

            assertThat(result).isEqualTo("Медали за 01.05.2024:\n🥇 #alice — 1 234 567 шагов");
        }
    }

    @DisplayName("셀 메달 기호 추가")
    @Nested
    class AppendMedalSymbol {
        @DisplayName("기존 메달 기호를 모두 지우고 하나만 붙인다.")
        @ParameterizedTest
        @CsvSource(value = {
            "8000|🥇|8000 🥇",
            "8000 🥈|🥇|8000 🥇",
            "8000 🥇|🥇|8000 🥇",
            "8000 🥇 🥉 |🥈|8000 🥈",
            "|🥉|🥉"
        }, delimiter = '|')
        void replacesExistingSymbols(String cellText, String symbol, String expected) {
            assertThat(renderer.appendMedalSymbol(cellText, symbol)).isEqualTo(expected);
        }

        @DisplayName("여러 번 적용해도 결과가 같다.")
        @Test
        void isIdempotent() {
            String once = renderer.appendMedalSymbol("12000", Medal.GOLD.getSymbol());
            String twice = renderer.appendMedalSymbol(once, Medal.GOLD.getSymbol());

            assertThat(twice).isEqualTo(once);
        }
    }
}
