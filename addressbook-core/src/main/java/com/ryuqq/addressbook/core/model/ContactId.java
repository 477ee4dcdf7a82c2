package com.ryuqq.addressbook.core.model;

import java.util.regex.Pattern;

/**
 * Contact의 전역 고유 식별자.
 *
 * <p>ContactId는 저장소가 Contact를 생성할 때 발급하며, 이후 변경되지 않습니다.
 * 삭제된 Contact의 ContactId는 재사용되지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * <p>정렬 순서는 값의 사전순이며, 검색 결과의 결정적 순서로 사용됩니다.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public final class ContactId implements Comparable<ContactId> {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[a-zA-Z0-9\\-_]+$");

    private final String value;

    private ContactId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ContactId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ContactId length cannot exceed 255 characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("ContactId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * ContactId 생성.
     *
     * @param value ContactId 값
     * @return ContactId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ContactId of(String value) {
        return new ContactId(value);
    }

    /**
     * ContactId 값 조회.
     *
     * @return ContactId 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(ContactId other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContactId contactId = (ContactId) o;
        return value.equals(contactId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ContactId{" + value + '}';
    }
}
