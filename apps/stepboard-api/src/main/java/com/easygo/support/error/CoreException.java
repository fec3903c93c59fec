package com.easygo.support.error;

import lombok.Getter;

/**
 * 도메인 및 애플리케이션 계층에서 사용하는 공통 예외.
 * <p>
 * {@link ErrorType}으로 HTTP 상태와 에러 코드를 결정하며,
 * 사용자에게 노출할 메시지를 별도로 지정할 수 있습니다.
 * </p>
 *
 * @author EasyGo
 * @version 1.0
 */
@Getter
public class CoreException extends RuntimeException {
    private final ErrorType errorType;
    private final String customMessage;

    public CoreException(ErrorType errorType) {
        this(errorType, null);
    }

    public CoreException(ErrorType errorType, String customMessage) {
        super(customMessage != null ? customMessage : errorType.getMessage());
        this.errorType = errorType;
        this.customMessage = customMessage;
    }
}
