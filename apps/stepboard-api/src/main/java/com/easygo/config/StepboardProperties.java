package com.easygo.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 스텝보드 애플리케이션 설정.
 * <p>
 * 기준 시간대, 채팅 허용 목록, 메시지 보관 기간, 구글 시트 연동 정보를 관리합니다.
 * </p>
 *
 * @author EasyGo
 */
@Configuration
@ConfigurationProperties(prefix = "stepboard")
public class StepboardProperties {

    /**
     * 날짜 계산 기준 시간대 (보고 날짜 기본값, 메달 집계 대상일)
     */
    private String zone = "Europe/Moscow";

    private final Chat chat = new Chat();

    private final Sheets sheets = new Sheets();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Chat getChat() {
        return chat;
    }

    public Sheets getSheets() {
        return sheets;
    }

    public static class Chat {

        /**
         * 메시지를 처리할 채팅 ID 목록. 비어 있으면 모든 채팅을 허용합니다.
         */
        private List<Long> allowedChatIds = new ArrayList<>();

        /**
         * 메달 요약을 게시할 채널 ID. 없으면 게시하지 않습니다.
         */
        private Long reportChannelId;

        /**
         * 수신 메시지 보관 기간
         */
        private Duration historyRetention = Duration.ofHours(24);

        public List<Long> getAllowedChatIds() {
            return allowedChatIds;
        }

        public void setAllowedChatIds(List<Long> allowedChatIds) {
            this.allowedChatIds = allowedChatIds;
        }

        public Long getReportChannelId() {
            return reportChannelId;
        }

        public void setReportChannelId(Long reportChannelId) {
            this.reportChannelId = reportChannelId;
        }

        public Duration getHistoryRetention() {
            return historyRetention;
        }

        public void setHistoryRetention(Duration historyRetention) {
            this.historyRetention = historyRetention;
        }

        public boolean isAllowed(Long chatId) {
            return allowedChatIds.isEmpty() || allowedChatIds.contains(chatId);
        }
    }

    public static class Sheets {

        /**
         * 구글 시트 연동 활성화 여부
         */
        private boolean enabled = false;

        private String spreadsheetId;

        /**
         * 걸음 수를 기록할 워크시트 이름
         */
        private String worksheet = "Sheet1";

        /**
         * 서비스 계정 키(JSON) 파일 경로
         */
        private String credentialsPath;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSpreadsheetId() {
            return spreadsheetId;
        }

        public void setSpreadsheetId(String spreadsheetId) {
            this.spreadsheetId = spreadsheetId;
        }

        public String getWorksheet() {
            return worksheet;
        }

        public void setWorksheet(String worksheet) {
            this.worksheet = worksheet;
        }

        public String getCredentialsPath() {
            return credentialsPath;
        }

        public void setCredentialsPath(String credentialsPath) {
            this.credentialsPath = credentialsPath;
        }
    }
}
