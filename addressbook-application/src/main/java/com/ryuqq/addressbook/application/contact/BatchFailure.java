package com.ryuqq.addressbook.application.contact;

import com.ryuqq.addressbook.core.exception.ContactStoreException;
import com.ryuqq.addressbook.core.exception.ErrorCode;

/**
 * 배치 항목 하나의 실패 정보.
 *
 * @param index 요청 목록에서의 위치 (0부터)
 * @param errorCode 오류 분류
 * @param message 오류 메시지
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record BatchFailure(int index, ErrorCode errorCode, String message) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException index가 음수이거나 errorCode가 null인 경우
     */
    public BatchFailure {
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative");
        }
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
    }

    /**
     * 저장소 예외로부터 생성.
     *
     * @param index 항목 위치
     * @param exception 발생한 예외
     * @return BatchFailure 인스턴스
     */
    public static BatchFailure of(int index, ContactStoreException exception) {
        return new BatchFailure(index, exception.getErrorCode(), exception.getMessage());
    }
}
