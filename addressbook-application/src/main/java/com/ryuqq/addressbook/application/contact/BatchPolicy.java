package com.ryuqq.addressbook.application.contact;

/**
 * 배치 요청 중 항목 하나가 실패했을 때의 처리 방식.
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public enum BatchPolicy {

    /**
     * 각 항목을 독립적으로 처리 (실패 항목만 제외).
     */
    CONTINUE_ON_ERROR,

    /**
     * 첫 실패에서 중단. 이미 반영된 항목은 유지되고 나머지는 건너뜁니다.
     */
    STOP_ON_FIRST_ERROR
}
