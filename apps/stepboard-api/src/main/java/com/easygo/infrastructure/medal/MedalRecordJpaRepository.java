package com.easygo.infrastructure.medal;

import com.easygo.domain.medal.MedalRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * MedalRecord 엔티티를 위한 Spring Data JPA 리포지토리.
 */
public interface MedalRecordJpaRepository extends JpaRepository<MedalRecord, Long> {

    Optional<MedalRecord> findByAwardDateAndNickname(LocalDate awardDate, String nickname);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT mr FROM MedalRecord mr WHERE mr.awardDate = :awardDate AND mr.nickname = :nickname")
    Optional<MedalRecord> findByAwardDateAndNicknameForUpdate(
        @Param("awardDate") LocalDate awardDate,
        @Param("nickname") String nickname
    );

    List<MedalRecord> findAllByAwardDate(LocalDate awardDate);
}
