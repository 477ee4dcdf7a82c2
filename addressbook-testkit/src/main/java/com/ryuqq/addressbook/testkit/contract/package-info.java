/**
 * Reusable contract tests for {@link com.ryuqq.addressbook.core.spi.ContactStore} implementations.
 *
 * <p>Each {@code Abstract*ContractTest} class holds one group of scenarios. An adapter module
 * runs them by extending the class in its own test sources and returning its store from
 * {@code createStore}.</p>
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.testkit.contract;
