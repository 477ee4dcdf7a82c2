package com.ryuqq.addressbook.application.validation;

import com.ryuqq.addressbook.core.exception.InvalidInputException;
import com.ryuqq.addressbook.core.model.ContactDraft;
import com.ryuqq.addressbook.core.model.ContactPatch;

/**
 * Contact 필드 형식 검증기.
 *
 * <p>저장소는 필수 필드만 확인하므로, 전화번호 숫자 패턴과 이메일 구문 같은 형식 규칙은
 * 저장소 호출 전에 이 검증기가 확인합니다.</p>
 *
 * <p><strong>검증 규칙:</strong></p>
 * <ul>
 *   <li>name, phone, email: null 또는 빈 문자열 불가</li>
 *   <li>email: '@' 포함, 마지막 '@' 뒤 도메인에 '.' 포함</li>
 *   <li>phone: '-', 공백, '(', ')' 제거 후 숫자만 남고 10자리 이상</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class ContactValidator {

    private static final int MIN_PHONE_DIGITS = 10;

    /**
     * 생성 요청 검증.
     *
     * @param draft 생성 요청
     * @throws InvalidInputException 규칙 위반 시
     */
    public void validateDraft(ContactDraft draft) {
        if (draft == null) {
            throw InvalidInputException.forRequest("Contact data cannot be null");
        }
        requireText("name", draft.name());
        requireText("phone", draft.phone());
        requireText("email", draft.email());
        validateEmail(draft.email());
        validatePhone(draft.phone());
    }

    /**
     * 수정 요청 검증.
     *
     * <p>패치에 포함된 필드만 검증합니다.</p>
     *
     * @param patch 수정 요청
     * @throws InvalidInputException 규칙 위반 시
     */
    public void validatePatch(ContactPatch patch) {
        if (patch == null) {
            throw InvalidInputException.forRequest("Update data cannot be null");
        }
        patch.nameIfPresent().ifPresent(name -> requireText("name", name));
        patch.phoneIfPresent().ifPresent(phone -> {
            requireText("phone", phone);
            validatePhone(phone);
        });
        patch.emailIfPresent().ifPresent(email -> {
            requireText("email", email);
            validateEmail(email);
        });
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw InvalidInputException.forField(field, "Field '" + field + "' must be a non-empty string");
        }
    }

    private static void validateEmail(String email) {
        int at = email.lastIndexOf('@');
        if (at < 0 || email.indexOf('.', at) < 0) {
            throw InvalidInputException.forField("email", "Invalid email format: " + email);
        }
    }

    private static void validatePhone(String phone) {
        String digits = phone.replace("-", "")
                .replace(" ", "")
                .replace("(", "")
                .replace(")", "");
        boolean allDigits = !digits.isEmpty() && digits.chars().allMatch(c -> c >= '0' && c <= '9');
        if (!allDigits || digits.length() < MIN_PHONE_DIGITS) {
            throw InvalidInputException.forField("phone", "Invalid phone format: " + phone);
        }
    }
}
