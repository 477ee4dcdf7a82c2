package com.ryuqq.addressbook.application.contact;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ContactServiceConfig 테스트.
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
class ContactServiceConfigTest {

    @Test
    void 기본값_확인() {
        ContactServiceConfig config = new ContactServiceConfig();

        assertThat(config.batchPolicy()).isEqualTo(BatchPolicy.CONTINUE_ON_ERROR);
        assertThat(config.maxBatchSize()).isEqualTo(1000);
    }

    @Test
    void with_메서드는_새_인스턴스_반환() {
        ContactServiceConfig original = new ContactServiceConfig();

        ContactServiceConfig changed = original
            .withBatchPolicy(BatchPolicy.STOP_ON_FIRST_ERROR)
            .withMaxBatchSize(10);

        assertThat(changed).isEqualTo(new ContactServiceConfig(BatchPolicy.STOP_ON_FIRST_ERROR, 10));
        assertThat(original).isEqualTo(new ContactServiceConfig());
    }

    @Test
    void 잘못된_값_거부() {
        assertThatThrownBy(() -> new ContactServiceConfig(null, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchPolicy cannot be null");
        assertThatThrownBy(() -> new ContactServiceConfig(BatchPolicy.CONTINUE_ON_ERROR, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxBatchSize must be positive");
    }
}
