package com.ryuqq.addressbook.core.exception;

/**
 * 저장소 오류 분류.
 *
 * <p>모든 오류는 결정적이며 재시도 대상이 아닙니다. 같은 저장소 상태와 같은 입력이면
 * 항상 같은 오류가 발생합니다.</p>
 *
 * <ul>
 *   <li>{@link #INVALID_INPUT}: 필수 필드 누락 또는 형식 오류 (변경 전에 검출)</li>
 *   <li>{@link #NOT_FOUND}: 존재하지 않는 ContactId 참조</li>
 *   <li>{@link #CONFLICT}: 전화번호 또는 이메일 중복</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public enum ErrorCode {

    INVALID_INPUT("CONTACT-400"),
    NOT_FOUND("CONTACT-404"),
    CONFLICT("CONTACT-409");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * 외부 계층에 노출하는 오류 코드.
     *
     * @return 오류 코드 (예: CONTACT-409)
     */
    public String code() {
        return code;
    }
}
