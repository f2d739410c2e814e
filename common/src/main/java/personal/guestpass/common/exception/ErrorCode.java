package personal.guestpass.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (1xxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Guest Grant Domain (Gxxx)
    GUEST_GRANT_NOT_FOUND(HttpStatus.NOT_FOUND, "G001", "게스트 권한 정보를 찾을 수 없습니다."),
    INVALID_GRANT_WINDOW(HttpStatus.BAD_REQUEST, "G002", "경고 시각은 만료 시각보다 앞서야 합니다."),

    // External Service (Exxx)
    EXTERNAL_SERVICE_ERROR(HttpStatus.SERVICE_UNAVAILABLE, "E001", "외부 서비스 오류가 발생했습니다."),
    EXTERNAL_REQUEST_REJECTED(HttpStatus.BAD_GATEWAY, "E003", "외부 서비스가 요청을 거부했습니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
