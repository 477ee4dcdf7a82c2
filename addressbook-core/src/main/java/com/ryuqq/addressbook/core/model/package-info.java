/**
 * Core domain model package containing the contact record and its request types.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.addressbook.core.model.ContactId} - Contact unique identifier</li>
 *   <li>{@link com.ryuqq.addressbook.core.model.Contact} - Immutable contact record</li>
 * </ul>
 *
 * <h2>Requests</h2>
 * <ul>
 *   <li>{@link com.ryuqq.addressbook.core.model.ContactDraft} - Fields for a new contact</li>
 *   <li>{@link com.ryuqq.addressbook.core.model.ContactPatch} - Partial update (absent field = unchanged)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Every type is immutable; updates produce new instances</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.core.model;
