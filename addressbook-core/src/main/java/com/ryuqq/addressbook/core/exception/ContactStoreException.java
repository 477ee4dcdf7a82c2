package com.ryuqq.addressbook.core.exception;

/**
 * 저장소 작업 실패의 공통 상위 타입.
 *
 * <p>호출자는 {@link #getErrorCode()}로 실패 유형을 구분할 수 있으며,
 * HTTP 상태 코드 매핑 등 사용자에게 보이는 동작은 호출 계층이 결정합니다.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public abstract class ContactStoreException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ContactStoreException(ErrorCode errorCode, String message) {
        super(message);
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        this.errorCode = errorCode;
    }

    /**
     * 오류 분류 조회.
     *
     * @return 오류 분류
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
