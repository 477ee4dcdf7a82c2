package com.ryuqq.addressbook.application.contact;

import com.ryuqq.addressbook.core.model.Contact;

import java.util.List;

/**
 * 배치 요청 처리 결과.
 *
 * <p>반영된 Contact는 요청 순서를 유지합니다. {@link BatchPolicy#STOP_ON_FIRST_ERROR}에서
 * 첫 실패 이후 처리되지 않은 항목 수는 {@code skipped}에 담깁니다.</p>
 *
 * @param applied 반영된 Contact 목록
 * @param failures 실패 항목 목록
 * @param skipped 처리하지 않은 항목 수
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public record BatchResult(List<Contact> applied, List<BatchFailure> failures, int skipped) {

    public BatchResult {
        applied = List.copyOf(applied);
        failures = List.copyOf(failures);
        if (skipped < 0) {
            throw new IllegalArgumentException("skipped cannot be negative");
        }
    }

    /**
     * 모든 항목이 반영되었는지 확인.
     *
     * @return 실패와 건너뛴 항목이 없으면 true
     */
    public boolean isComplete() {
        return failures.isEmpty() && skipped == 0;
    }
}
