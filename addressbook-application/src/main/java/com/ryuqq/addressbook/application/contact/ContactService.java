package com.ryuqq.addressbook.application.contact;

import com.ryuqq.addressbook.application.validation.ContactValidator;
import com.ryuqq.addressbook.core.exception.ContactStoreException;
import com.ryuqq.addressbook.core.exception.InvalidInputException;
import com.ryuqq.addressbook.core.model.Contact;
import com.ryuqq.addressbook.core.model.ContactDraft;
import com.ryuqq.addressbook.core.model.ContactId;
import com.ryuqq.addressbook.core.spi.ContactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Contact 요청 처리 서비스.
 *
 * <p>배치 요청을 저장소의 단건 연산으로 분배합니다. 저장소는 단건 원자성만 보장하므로
 * 부분 성공 여부는 {@link BatchPolicy}로 이 계층에서 결정합니다.</p>
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>요청 크기 검증 (빈 배치, maxBatchSize 초과 시 즉시 거부)</li>
 *   <li>항목별 형식 검증 ({@link ContactValidator})</li>
 *   <li>저장소 단건 연산 호출</li>
 *   <li>실패 항목은 {@link BatchFailure}로 기록</li>
 * </ol>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>{@link ContactStoreException}: 항목 실패로 기록</li>
 *   <li>그 외 예외: 그대로 전파 (배치 중단)</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public class ContactService {

    private static final Logger log = LoggerFactory.getLogger(ContactService.class);

    private final ContactStore store;
    private final ContactValidator validator;
    private final ContactServiceConfig config;

    /**
     * 기본 설정 생성자.
     *
     * @param store Contact 저장소
     */
    public ContactService(ContactStore store) {
        this(store, new ContactValidator(), new ContactServiceConfig());
    }

    /**
     * 생성자.
     *
     * @param store Contact 저장소
     * @param validator 필드 형식 검증기
     * @param config 서비스 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ContactService(ContactStore store, ContactValidator validator, ContactServiceConfig config) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.store = store;
        this.validator = validator;
        this.config = config;
    }

    /**
     * Contact 일괄 생성.
     *
     * @param drafts 생성 요청 목록
     * @return 배치 처리 결과
     * @throws InvalidInputException 요청 목록이 비었거나 maxBatchSize를 초과한 경우
     */
    public BatchResult createContacts(List<ContactDraft> drafts) {
        requireBatch(drafts);
        return runBatch("create", drafts, draft -> {
            validator.validateDraft(draft);
            return store.create(draft);
        });
    }

    /**
     * Contact 일괄 수정.
     *
     * <p>항목은 요청 순서대로 적용됩니다. 같은 ID가 여러 번 나오면 뒤 항목이 앞 항목의
     * 결과 위에 적용됩니다.</p>
     *
     * @param updates 수정 요청 목록
     * @return 배치 처리 결과
     * @throws InvalidInputException 요청 목록이 비었거나 maxBatchSize를 초과한 경우
     */
    public BatchResult updateContacts(List<ContactUpdate> updates) {
        requireBatch(updates);
        return runBatch("update", updates, update -> {
            if (update == null || update.id() == null) {
                throw InvalidInputException.forField("id", "Contact id is required");
            }
            validator.validatePatch(update.patch());
            return store.update(update.id(), update.patch());
        });
    }

    /**
     * Contact 일괄 삭제.
     *
     * <p>존재하지 않는 ID는 무시합니다.</p>
     *
     * @param ids 삭제할 ID 목록
     * @return 실제 삭제된 개수
     * @throws InvalidInputException 요청 목록이 비었거나 maxBatchSize를 초과한 경우
     */
    public int deleteContacts(Collection<ContactId> ids) {
        requireBatch(ids);
        if (ids.stream().anyMatch(id -> id == null)) {
            throw InvalidInputException.forField("ids", "All IDs must be non-null");
        }
        int deleted = store.delete(ids);
        log.info("Delete batch completed: {} of {} requested", deleted, ids.size());
        return deleted;
    }

    /**
     * Contact 검색.
     *
     * @param query 검색어
     * @return 일치하는 Contact 목록 (빈 검색어이면 저장소를 호출하지 않고 빈 목록)
     */
    public List<Contact> searchContacts(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        return store.search(query);
    }

    /**
     * Contact 단건 조회.
     *
     * @param id Contact ID
     * @return Contact
     * @throws com.ryuqq.addressbook.core.exception.NotFoundException 존재하지 않는 경우
     */
    public Contact getContact(ContactId id) {
        return store.get(id);
    }

    /**
     * 전체 Contact 조회.
     *
     * @return ID 오름차순 Contact 목록
     */
    public List<Contact> getAllContacts() {
        return store.findAll();
    }

    private void requireBatch(Collection<?> items) {
        if (items == null || items.isEmpty()) {
            throw InvalidInputException.forRequest("Request body cannot be empty");
        }
        if (items.size() > config.maxBatchSize()) {
            throw InvalidInputException.forRequest(
                "Batch size " + items.size() + " exceeds limit " + config.maxBatchSize()
            );
        }
    }

    private <T> BatchResult runBatch(String operation, List<T> items, Function<T, Contact> action) {
        List<Contact> applied = new ArrayList<>(items.size());
        List<BatchFailure> failures = new ArrayList<>();
        int skipped = 0;

        for (int i = 0; i < items.size(); i++) {
            try {
                applied.add(action.apply(items.get(i)));
            } catch (ContactStoreException e) {
                log.warn("Rejected {} item {}: [{}] {}", operation, i, e.getErrorCode().code(), e.getMessage());
                failures.add(BatchFailure.of(i, e));
                if (config.batchPolicy() == BatchPolicy.STOP_ON_FIRST_ERROR) {
                    skipped = items.size() - i - 1;
                    break;
                }
            }
        }

        log.info("{} batch completed: {} applied, {} failed, {} skipped",
            operation, applied.size(), failures.size(), skipped);
        return new BatchResult(applied, failures, skipped);
    }
}
