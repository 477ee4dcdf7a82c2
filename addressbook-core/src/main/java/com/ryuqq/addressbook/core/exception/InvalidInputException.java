package com.ryuqq.addressbook.core.exception;

/**
 * 필수 필드 누락 또는 형식 오류.
 *
 * <p>항상 저장소 변경 전에 발생하므로 이 예외가 던져지면 저장소 상태는 바뀌지 않습니다.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class InvalidInputException extends ContactStoreException {

    private final String field;

    /**
     * 생성자.
     *
     * @param field 문제가 된 필드 이름 (요청 전체에 대한 오류이면 null)
     * @param message 오류 메시지
     */
    public InvalidInputException(String field, String message) {
        super(ErrorCode.INVALID_INPUT, message);
        this.field = field;
    }

    /**
     * 필드 단위 오류 생성.
     *
     * @param field 필드 이름
     * @param message 오류 메시지
     * @return InvalidInputException 인스턴스
     */
    public static InvalidInputException forField(String field, String message) {
        return new InvalidInputException(field, message);
    }

    /**
     * 요청 단위 오류 생성.
     *
     * @param message 오류 메시지
     * @return InvalidInputException 인스턴스
     */
    public static InvalidInputException forRequest(String message) {
        return new InvalidInputException(null, message);
    }

    /**
     * 문제가 된 필드 이름.
     *
     * @return 필드 이름 (null 가능)
     */
    public String getField() {
        return field;
    }
}
