package com.ryuqq.addressbook.application.contact;

import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.model.ContactPatch;

/**
 * 배치 수정 요청의 항목 하나.
 *
 * @param id 수정할 Contact
 * @param patch 변경할 필드
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record ContactUpdate(ContactId id, ContactPatch patch) {

    public static ContactUpdate of(ContactId id, ContactPatch patch) {
        return new ContactUpdate(id, patch);
    }
}
