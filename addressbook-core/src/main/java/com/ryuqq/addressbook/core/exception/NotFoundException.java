package com.ryuqq.addressbook.core.exception;

import com.ryuqq.addressbook.core.model.ContactId;

/**
 * 존재하지 않는 Contact를 참조한 경우.
 *
 * <p>delete는 이 예외를 던지지 않습니다. 없는 식별자는 삭제 개수에서 제외될 뿐입니다.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class NotFoundException extends ContactStoreException {

    private final ContactId contactId;

    public NotFoundException(ContactId contactId) {
        super(ErrorCode.NOT_FOUND, "Contact not found: " + contactId);
        this.contactId = contactId;
    }

    public ContactId getContactId() {
        return contactId;
    }
}
