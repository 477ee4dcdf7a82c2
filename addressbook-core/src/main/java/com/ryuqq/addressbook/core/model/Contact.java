package com.ryuqq.addressbook.core.model;

/**
 * 주소록 항목 하나.
 *
 * <p>Contact는 불변 record이므로 저장소 밖에서 보유한 참조로 저장소 상태를 바꿀 수 없습니다.
 * 필드 변경은 항상 {@code ContactStore#update}를 통해서만 이루어지며,
 * 저장소는 {@link #withName}, {@link #withPhone}, {@link #withEmail}로 만든 새 인스턴스로 교체합니다.</p>
 *
 * <p>필드 값은 입력받은 그대로 보관됩니다. 정규화된 키는 인덱스에서만 사용됩니다.</p>
 *
 * @param id 식별자 (저장소가 발급)
 * @param name 이름 (빈 문자열 불가)
 * @param phone 전화번호
 * @param email 이메일
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record Contact(
    ContactId id,
    String name,
    String phone,
    String email
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null이거나 빈 문자열인 경우
     */
    public Contact {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("phone cannot be null or blank");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
    }

    /**
     * 이름만 변경한 새 인스턴스 생성.
     *
     * @param name 새 이름
     * @return 새 Contact 인스턴스
     */
    public Contact withName(String name) {
        return new Contact(id, name, phone, email);
    }

    /**
     * 전화번호만 변경한 새 인스턴스 생성.
     *
     * @param phone 새 전화번호
     * @return 새 Contact 인스턴스
     */
    public Contact withPhone(String phone) {
        return new Contact(id, name, phone, email);
    }

    /**
     * 이메일만 변경한 새 인스턴스 생성.
     *
     * @param email 새 이메일
     * @return 새 Contact 인스턴스
     */
    public Contact withEmail(String email) {
        return new Contact(id, name, phone, email);
    }
}
