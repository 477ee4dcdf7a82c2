package com.ryuqq.addressbook.core.exception;

import com.ryuqq.addressbook.core.model.ContactId;

/**
 * 전화번호 또는 이메일이 다른 Contact에 이미 등록된 경우.
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class ConflictException extends ContactStoreException {

    private final String field;
    private final ContactId ownerId;

    /**
     * 생성자.
     *
     * @param field 충돌한 필드 ("phone" 또는 "email")
     * @param key 충돌한 정규화 키
     * @param ownerId 해당 키를 이미 가진 Contact
     */
    public ConflictException(String field, String key, ContactId ownerId) {
        super(ErrorCode.CONFLICT, field + " '" + key + "' is already used by " + ownerId);
        this.field = field;
        this.ownerId = ownerId;
    }

    public String getField() {
        return field;
    }

    public ContactId getOwnerId() {
        return ownerId;
    }
}
