package com.ryuqq.addressbook.core.model;

/**
 * Contact 생성 요청.
 *
 * <p>식별자가 없는 Contact입니다. 값 검증은 수행하지 않으며,
 * 필수 필드 검사는 저장소가, 형식 검사는 {@code ContactValidator}가 담당합니다.</p>
 *
 * @param name 이름
 * @param phone 전화번호
 * @param email 이메일
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record ContactDraft(String name, String phone, String email) {

    /**
     * ContactDraft 생성.
     *
     * @param name 이름
     * @param phone 전화번호
     * @param email 이메일
     * @return ContactDraft 인스턴스
     */
    public static ContactDraft of(String name, String phone, String email) {
        return new ContactDraft(name, phone, email);
    }
}
