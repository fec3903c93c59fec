package com.easygo.application.report;

import com.easygo.domain.report.ReportParser;
import com.easygo.domain.report.StepReport;
import com.easygo.domain.report.StepReportService;
import com.easygo.domain.sheet.StepSheet;
import com.easygo.domain.user.NicknameResolver;
import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class ReportFacadeTest {

    // 모스크바 기준 2025-06-10 00:30 (UTC로는 아직 6월 9일)
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-09T21:30:00Z"), ZoneId.of("Europe/Moscow"));

    @Mock
    private NicknameResolver nicknameResolver;

    @Mock
    private StepReportService stepReportService;

    @Mock
    private StepSheet stepSheet;

    private ReportFacade reportFacade;

    @BeforeEach
    void setUp() {
        reportFacade = new ReportFacade(new ReportParser(CLOCK), nicknameResolver, stepReportService, stepSheet, CLOCK);
    }

    private void stubUpsert() {
        when(stepReportService.upsert(any(), anyString(), any(LocalDate.class), any(Integer.class)))
            .thenAnswer(invocation -> StepReport.of(
                invocation.getArgument(0),
                invocation.getArgument(1),
                invocation.getArgument(2),
                invocation.getArgument(3)
            ));
    }

    @DisplayName("보고 제출에 성공하는 경우")
    @Nested
    class Success {
        @DisplayName("파싱된 필드로 보고를 저장하고 시트에 기록한다.")
        @Test
        void savesReportAndWritesSheet() {
            when(nicknameResolver.resolve(7L, "alice")).thenReturn("alice");
            stubUpsert();

            ReportInfo result = reportFacade.submit(7L, "#отчет #alice 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("alice");
            assertThat(result.reportDate()).isEqualTo(LocalDate.of(2024, 5, 1));
            assertThat(result.steps()).isEqualTo(8000);
            verify(stepSheet).writeSteps("alice", LocalDate.of(2024, 5, 1), 8000);
        }

        @DisplayName("날짜가 없으면, 기준 시간대의 오늘 날짜를 사용한다.")
        @Test
        void usesTodayInConfiguredZone_whenDateIsMissing() {
            when(nicknameResolver.resolve(7L, "alice")).thenReturn("alice");
            stubUpsert();

            ReportInfo result = reportFacade.submit(7L, "#отчет #alice 8000");

            assertThat(result.reportDate()).isEqualTo(LocalDate.of(2025, 6, 10));
        }

        @DisplayName("닉네임이 없으면, 저장된 프로필의 닉네임을 사용한다.")
        @Test
        void usesStoredNickname_whenNicknameIsMissing() {
            when(nicknameResolver.resolve(7L, null)).thenReturn("alice");
            stubUpsert();

            ReportInfo result = reportFacade.submit(7L, "#отчет 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("alice");
        }

        @DisplayName("시트 기록에 실패해도, 보고는 저장된다.")
        @Test
        void keepsReport_whenSheetWriteFails() {
            when(nicknameResolver.resolve(7L, "alice")).thenReturn("alice");
            stubUpsert();
            doThrow(new IllegalStateException("sheet down")).when(stepSheet).writeSteps(anyString(), any(), anyInt());

            ReportInfo result = reportFacade.submit(7L, "#отчет #alice 1.5.2024 8000");

            assertThat(result.steps()).isEqualTo(8000);
        }

        @DisplayName("동시 삽입으로 저장이 롤백되면, 한 번 더 저장을 시도한다.")
        @Test
        void retriesUpsert_whenConcurrentInsertOccurs() {
            when(nicknameResolver.resolve(7L, "alice")).thenReturn("alice");
            when(stepReportService.upsert(7L, "alice", LocalDate.of(2024, 5, 1), 8000))
                .thenThrow(new DataIntegrityViolationException("duplicate"))
                .thenReturn(StepReport.of(7L, "alice", LocalDate.of(2024, 5, 1), 8000));

            ReportInfo result = reportFacade.submit(7L, "#отчет #alice 1.5.2024 8000");

            assertThat(result.steps()).isEqualTo(8000);
            verify(stepReportService, times(2)).upsert(7L, "alice", LocalDate.of(2024, 5, 1), 8000);
        }

        @DisplayName("프로필 동시 생성으로 롤백되면, 닉네임 결정을 한 번 더 시도한다.")
        @Test
        void retriesResolve_whenConcurrentProfileInsertOccurs() {
            when(nicknameResolver.resolve(7L, "alice"))
                .thenThrow(new DataIntegrityViolationException("duplicate"))
                .thenReturn("alice");
            stubUpsert();

            reportFacade.submit(7L, "#отчет #alice 1.5.2024 8000");

            verify(nicknameResolver, times(2)).resolve(7L, "alice");
        }

        @DisplayName("프로필 저장소 장애 시, 파싱된 닉네임으로 보고를 저장한다.")
        @Test
        void fallsBackToParsedNickname_whenResolverFails() {
            when(nicknameResolver.resolve(7L, "alice")).thenThrow(new DataAccessResourceFailureException("db down"));
            stubUpsert();

            ReportInfo result = reportFacade.submit(7L, "#отчет #alice 1.5.2024 8000");

            assertThat(result.nickname()).isEqualTo("alice");
        }
    }

    @DisplayName("보고 제출에 실패하는 경우")
    @Nested
    class Failure {
        @DisplayName("닉네임을 결정할 수 없으면, BAD_REQUEST 예외가 발생한다.")
        @Test
        void throwsBadRequest_whenNicknameIsMissing() {
            when(nicknameResolver.resolve(7L, null)).thenReturn(null);

            CoreException result = assertThrows(CoreException.class,
                () -> reportFacade.submit(7L, "#отчет 1.5.2024 8000"));

            assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
            assertThat(result.getCustomMessage()).isEqualTo(ReportFacade.MISSING_NICKNAME);
            verifyNoInteractions(stepReportService, stepSheet);
        }

        @DisplayName("걸음 수가 없으면, BAD_REQUEST 예외가 발생한다.")
        @Test
        void throwsBadRequest_whenStepsAreMissing() {
            when(nicknameResolver.resolve(7L, "alice")).thenReturn("alice");

            CoreException result = assertThrows(CoreException.class,
                () -> reportFacade.submit(7L, "#отчет #alice 1.5.2024"));

            assertThat(result.getErrorType()).isEqualTo(ErrorType.BAD_REQUEST);
            assertThat(result.getCustomMessage()).isEqualTo(ReportFacade.MISSING_STEPS);
            verifyNoInteractions(stepReportService, stepSheet);
        }
    }
}
