package com.ryuqq.addressbook.application.contact;

/**
 * ContactService 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchPolicy: 항목 실패 시 처리 방식 (기본 CONTINUE_ON_ERROR)</li>
 *   <li>maxBatchSize: 한 번에 받을 수 있는 최대 항목 수 (기본 1000)</li>
 * </ul>
 *
 * @author AddressBook Team
 * @since 1.0.0
 * @param batchPolicy 배치 처리 방식 (null 불가)
 * @param maxBatchSize 최대 배치 크기 (1 이상이어야 함)
 */
public record ContactServiceConfig(BatchPolicy batchPolicy, int maxBatchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: batchPolicy=CONTINUE_ON_ERROR, maxBatchSize=1000</p>
     */
    public ContactServiceConfig() {
        this(BatchPolicy.CONTINUE_ON_ERROR, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ContactServiceConfig {
        if (batchPolicy == null) {
            throw new IllegalArgumentException("batchPolicy cannot be null");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException(
                "maxBatchSize must be positive (current: " + maxBatchSize + ")"
            );
        }
    }

    /**
     * batchPolicy만 변경한 새 인스턴스 생성.
     *
     * @param batchPolicy 새로운 배치 처리 방식
     * @return 새 ContactServiceConfig 인스턴스
     */
    public ContactServiceConfig withBatchPolicy(BatchPolicy batchPolicy) {
        return new ContactServiceConfig(batchPolicy, this.maxBatchSize);
    }

    /**
     * maxBatchSize만 변경한 새 인스턴스 생성.
     *
     * @param maxBatchSize 새로운 최대 배치 크기
     * @return 새 ContactServiceConfig 인스턴스
     */
    public ContactServiceConfig withMaxBatchSize(int maxBatchSize) {
        return new ContactServiceConfig(this.batchPolicy, maxBatchSize);
    }
}
