/**
 * Key derivation shared by every index: phone/email normalization and name tokenization.
 *
 * @since 1.0.0
 * @author AddressBook Team
 */
package com.ryuqq.addressbook.core.key;
