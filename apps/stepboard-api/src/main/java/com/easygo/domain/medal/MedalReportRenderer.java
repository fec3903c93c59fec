package com.easygo.domain.medal;

import com.easygo.domain.report.StepReport;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 메달 결과를 사람이 읽을 수 있는 텍스트로 만듭니다.
 * <p>
 * <b>요약 형식:</b>
 * <pre>
 * Медали за 01.05.2024:
 * 🥇 #alice, #bob — 12 000 шагов
 * 🥈 #carol — 9 000 шагов
 * </pre>
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Component
public class MedalReportRenderer {

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    /**
     * 메달 요약 메시지를 생성합니다.
     * <p>
     * GOLD, SILVER, BRONZE 순서로 메달별 한 줄씩 출력하며,
     * 동률인 닉네임은 쉼표로 묶고 공통 걸음 수를 붙입니다.
     * </p>
     *
     * @param date 메달 대상 날짜
     * @param awards 수상 목록
     * @return 요약 텍스트
     */
    public String render(LocalDate date, List<MedalAward> awards) {
        Map<Medal, List<StepReport>> byMedal = new EnumMap<>(Medal.class);
        for (MedalAward award : awards) {
            byMedal.computeIfAbsent(award.medal(), medal -> new ArrayList<>()).add(award.report());
        }

        List<String> lines = new ArrayList<>();
        lines.add("Медали за " + date.format(DATE_FORMATTER) + ":");
        for (Medal medal : Medal.values()) {
            List<StepReport> winners = byMedal.get(medal);
            if (winners == null || winners.isEmpty()) {
                continue;
            }
            String nicknames = winners.stream()
                .map(report -> hashtag(report.getNickname()))
                .collect(Collectors.joining(", "));
            lines.add(medal.getSymbol() + " " + nicknames + " — " + formatSteps(winners.get(0).getSteps()) + " шагов");
        }
        return String.join("\n", lines);
    }

    /**
     * 셀 텍스트 끝에 메달 기호를 붙입니다.
     * <p>
     * 이미 있는 메달 기호를 모두 지운 뒤 정확히 하나만 붙이므로,
     * 같은 셀에 여러 번 적용해도 결과가 같습니다.
     * </p>
     *
     * @param cellText 기존 셀 텍스트 (null 허용)
     * @param symbol 붙일 메달 기호
     * @return 새 셀 텍스트
     */
    public String appendMedalSymbol(String cellText, String symbol) {
        String stripped = cellText == null ? "" : cellText;
        for (String known : Medal.symbols()) {
            stripped = stripped.replace(known, "");
        }
        stripped = stripped.strip();
        return stripped.isEmpty() ? symbol : stripped + " " + symbol;
    }

    private String hashtag(String nickname) {
        return nickname.startsWith("#") ? nickname : "#" + nickname;
    }

    private String formatSteps(int steps) {
        return String.format(Locale.ROOT, "%,d", steps).replace(',', ' ');
    }
}
