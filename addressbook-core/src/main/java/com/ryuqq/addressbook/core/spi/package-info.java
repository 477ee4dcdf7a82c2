/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement to provide
 * contact storage.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.addressbook.core.spi.ContactStore} - Indexed contact storage</li>
 *   <li>{@link com.ryuqq.addressbook.core.spi.ContactIdGenerator} - Identifier generation</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 *   <li><strong>Pluggability:</strong> Every implementation must pass the testkit contract tests</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.core.spi;
