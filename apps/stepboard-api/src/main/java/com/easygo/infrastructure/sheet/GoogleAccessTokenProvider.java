package com.easygo.infrastructure.sheet;

import com.easygo.support.error.CoreException;
import com.easygo.support.error.ErrorType;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

/**
 * 구글 시트 API 호출에 쓸 OAuth 액세스 토큰을 제공합니다.
 * <p>
 * 서비스 계정 키 파일은 첫 요청 시점에 읽고, 이후에는 만료가 가까울 때마다 토큰을 갱신합니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Slf4j
public class GoogleAccessTokenProvider {

    static final String SPREADSHEETS_SCOPE = "https://www.googleapis.com/auth/spreadsheets";

    private final Supplier<GoogleCredentials> credentialsLoader;
    private GoogleCredentials credentials;

    public GoogleAccessTokenProvider(String credentialsPath) {
        this(() -> load(credentialsPath));
    }

    GoogleAccessTokenProvider(GoogleCredentials credentials) {
        this(() -> credentials);
    }

    private GoogleAccessTokenProvider(Supplier<GoogleCredentials> credentialsLoader) {
        this.credentialsLoader = credentialsLoader;
    }

    /**
     * 유효한 액세스 토큰 값을 반환합니다.
     *
     * @return Bearer 헤더에 넣을 토큰 값
     * @throws CoreException 키 파일을 읽지 못했거나 토큰 갱신에 실패한 경우
     */
    public synchronized String currentToken() {
        if (credentials == null) {
            credentials = credentialsLoader.get();
        }
        try {
            credentials.refreshIfExpired();
        } catch (IOException e) {
            log.error("구글 액세스 토큰 갱신 실패", e);
            throw new CoreException(ErrorType.INTERNAL_ERROR, "구글 액세스 토큰을 갱신하지 못했습니다.");
        }
        AccessToken accessToken = credentials.getAccessToken();
        if (accessToken == null) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, "구글 액세스 토큰이 없습니다.");
        }
        return accessToken.getTokenValue();
    }

    private static GoogleCredentials load(String credentialsPath) {
        if (credentialsPath == null || credentialsPath.isBlank()) {
            throw new CoreException(ErrorType.INTERNAL_ERROR, "구글 서비스 계정 키 경로가 설정되지 않았습니다.");
        }
        try (InputStream in = Files.newInputStream(Path.of(credentialsPath))) {
            return GoogleCredentials.fromStream(in).createScoped(List.of(SPREADSHEETS_SCOPE));
        } catch (IOException e) {
            log.error("구글 서비스 계정 키 로딩 실패: path={}", credentialsPath, e);
            throw new CoreException(ErrorType.INTERNAL_ERROR, "구글 서비스 계정 키를 읽지 못했습니다.");
        }
    }
}
