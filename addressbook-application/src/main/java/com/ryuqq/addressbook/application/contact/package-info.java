/**
 * Contact 애플리케이션 서비스.
 *
 * <p>배치 요청을 저장소의 단건 연산으로 분배하고 항목별 결과를 수집합니다.</p>
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.application.contact;
