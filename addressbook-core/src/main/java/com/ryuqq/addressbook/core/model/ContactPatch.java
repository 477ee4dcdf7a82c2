package com.ryuqq.addressbook.core.model;

import java.util.Optional;

/**
 * Contact 부분 수정 요청.
 *
 * <p>null인 필드는 "변경하지 않음"을 의미합니다. 모든 필드가 null이면 빈 패치이며,
 * 빈 패치로 update를 호출하면 현재 Contact가 그대로 반환됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ContactPatch patch = ContactPatch.empty().withPhone("555-000-1111");
 * store.update(id, patch);   // 이름, 이메일은 유지
 * </pre>
 *
 * @param name 새 이름 (null이면 유지)
 * @param phone 새 전화번호 (null이면 유지)
 * @param email 새 이메일 (null이면 유지)
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record ContactPatch(String name, String phone, String email) {

    private static final ContactPatch EMPTY = new ContactPatch(null, null, null);

    /**
     * 빈 패치.
     *
     * @return 아무 필드도 변경하지 않는 패치
     */
    public static ContactPatch empty() {
        return EMPTY;
    }

    public ContactPatch withName(String name) {
        return new ContactPatch(name, this.phone, this.email);
    }

    public ContactPatch withPhone(String phone) {
        return new ContactPatch(this.name, phone, this.email);
    }

    public ContactPatch withEmail(String email) {
        return new ContactPatch(this.name, this.phone, email);
    }

    public Optional<String> nameIfPresent() {
        return Optional.ofNullable(name);
    }

    public Optional<String> phoneIfPresent() {
        return Optional.ofNullable(phone);
    }

    public Optional<String> emailIfPresent() {
        return Optional.ofNullable(email);
    }

    /**
     * 변경할 필드가 하나도 없는지 확인.
     *
     * @return 빈 패치이면 true
     */
    public boolean isEmpty() {
        return name == null && phone == null && email == null;
    }

    /**
     * 패치를 Contact에 적용.
     *
     * @param current 현재 Contact
     * @return 패치가 적용된 새 Contact (빈 패치이면 current 그대로)
     */
    public Contact applyTo(Contact current) {
        if (isEmpty()) {
            return current;
        }
        return new Contact(
            current.id(),
            name != null ? name : current.name(),
            phone != null ? phone : current.phone(),
            email != null ? email : current.email()
        );
    }
}
