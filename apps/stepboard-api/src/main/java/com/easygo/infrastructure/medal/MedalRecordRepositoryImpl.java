package com.easygo.infrastructure.medal;

import com.easygo.domain.medal.MedalRecord;
import com.easygo.domain.medal.MedalRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * MedalRecordRepository의 JPA 구현체.
 *
 * @author EasyGo
 * @version 1.0
 */
@RequiredArgsConstructor
@Component
public class MedalRecordRepositoryImpl implements MedalRecordRepository {
    private final MedalRecordJpaRepository medalRecordJpaRepository;

    @Override
    public MedalRecord save(MedalRecord medalRecord) {
        return medalRecordJpaRepository.save(medalRecord);
    }

    @Override
    public Optional<MedalRecord> findByAwardDateAndNickname(LocalDate awardDate, String nickname) {
        return medalRecordJpaRepository.findByAwardDateAndNickname(awardDate, nickname);
    }

    @Override
    public Optional<MedalRecord> findByAwardDateAndNicknameForUpdate(LocalDate awardDate, String nickname) {
        return medalRecordJpaRepository.findByAwardDateAndNicknameForUpdate(awardDate, nickname);
    }

    @Override
    public List<MedalRecord> findAllByAwardDate(LocalDate awardDate) {
        return medalRecordJpaRepository.findAllByAwardDate(awardDate);
    }
}
