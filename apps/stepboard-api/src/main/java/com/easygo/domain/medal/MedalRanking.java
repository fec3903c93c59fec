package com.easygo.domain.medal;

import com.easygo.domain.report.StepReport;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 하루치 보고에 대한 메달 랭킹 계산기.
 * <p>
 * Dense ranking을 사용합니다. 걸음 수가 같은 보고는 같은 메달을 받으며,
 * 서로 다른 걸음 수 상위 3개까지만 메달을 부여합니다.
 * </p>
 * <p>
 * <b>예시:</b> {a:12000, b:12000, c:9000, d:9000, e:8000, f:7000}
 * → a, b GOLD / c, d SILVER / e BRONZE / f 없음
 * </p>
 * <p>
 * 상태가 없으므로 여러 스레드에서 동시에 호출해도 안전합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Component
public class MedalRanking {

    private static final int MEDAL_RANK_LIMIT = 3;

    private static final Comparator<StepReport> RANKING_ORDER =
        Comparator.comparing(StepReport::getSteps, Comparator.reverseOrder())
            .thenComparing(StepReport::getNickname);

    /**
     * 메달을 계산합니다.
     *
     * @param reports 같은 날짜의 보고 목록
     * @return 메달 수상 목록 (걸음 수 내림차순, 동률은 닉네임 오름차순). 입력이 비어 있으면 빈 목록.
     */
    public List<MedalAward> assign(List<StepReport> reports) {
        List<StepReport> sorted = reports.stream()
            .sorted(RANKING_ORDER)
            .toList();

        List<MedalAward> awards = new ArrayList<>();
        int rank = 0;
        Integer previousSteps = null;
        for (StepReport report : sorted) {
            if (!Objects.equals(report.getSteps(), previousSteps)) {
                rank++;
                previousSteps = report.getSteps();
            }
            if (rank > MEDAL_RANK_LIMIT) {
                break;
            }
            awards.add(new MedalAward(report, Medal.ofRank(rank)));
        }
        return awards;
    }
}
