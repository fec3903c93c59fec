package com.easygo.domain.medal;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * MedalRecord 엔티티에 대한 저장소 인터페이스.
 * <p>
 * (awardDate, nickname) 유니크 제약은 저장소 구현이 보장해야 합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
public interface MedalRecordRepository {

    MedalRecord save(MedalRecord medalRecord);

    /**
     * 날짜와 닉네임으로 메달 기록을 조회합니다.
     *
     * @param awardDate 메달 대상 날짜
     * @param nickname 닉네임
     * @return 조회된 메달 기록을 담은 Optional
     */
    Optional<MedalRecord> findByAwardDateAndNickname(LocalDate awardDate, String nickname);

    /**
     * 날짜와 닉네임으로 메달 기록을 조회합니다. (비관적 락)
     *
     * @param awardDate 메달 대상 날짜
     * @param nickname 닉네임
     * @return 조회된 메달 기록을 담은 Optional
     */
    Optional<MedalRecord> findByAwardDateAndNicknameForUpdate(LocalDate awardDate, String nickname);

    /**
     * 특정 날짜의 메달 기록을 조회합니다.
     *
     * @param awardDate 메달 대상 날짜
     * @return 메달 기록 목록 (메달 순서, 닉네임 오름차순)
     */
    List<MedalRecord> findAllByAwardDate(LocalDate awardDate);
}
