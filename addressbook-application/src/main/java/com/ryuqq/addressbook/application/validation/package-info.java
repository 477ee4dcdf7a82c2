/**
 * Field-format validation applied before the store is called.
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.application.validation;
