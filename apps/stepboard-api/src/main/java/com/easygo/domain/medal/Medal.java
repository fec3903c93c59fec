package com.easygo.domain.medal;

import java.util.Arrays;
import java.util.List;

/**
 * 일간 메달 종류.
 * <p>
 * 서로 다른 걸음 수 기준 1~3위에 각각 대응합니다.
 * </p>
 */
public enum Medal {
    GOLD(1, "🥇"),
    SILVER(2, "🥈"),
    BRONZE(3, "🥉");

    private final int rank;
    private final String symbol;

    Medal(int rank, String symbol) {
        this.rank = rank;
        this.symbol = symbol;
    }

    public int getRank() {
        return rank;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 순위에 해당하는 메달을 반환합니다.
     *
     * @param rank 순위 (1~3)
     * @return 메달
     * @throws IllegalArgumentException 1~3 범위를 벗어난 경우
     */
    public static Medal ofRank(int rank) {
        return Arrays.stream(values())
            .filter(medal -> medal.rank == rank)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("메달이 없는 순위입니다: " + rank));
    }

    public static List<String> symbols() {
        return Arrays.stream(values()).map(Medal::getSymbol).toList();
    }
}
