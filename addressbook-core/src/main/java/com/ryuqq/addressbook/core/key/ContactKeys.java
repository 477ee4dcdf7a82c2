package com.ryuqq.addressbook.core.key;

import java.util.Locale;

/**
 * Normalized uniqueness keys for phone and email.
 *
 * <p>Two contacts conflict when their keys are equal, not their raw values:</p>
 * <ul>
 *   <li>Phone key: every character other than ASCII digits and {@code +} removed
 *       ({@code "(555) 123-4567"} and {@code "555.123.4567"} share key {@code "5551234567"})</li>
 *   <li>Email key: trimmed and lower-cased with {@link Locale#ROOT}</li>
 * </ul>
 *
 * <p>A phone key is only meaningful for text accepted by {@link #isPhoneText(String)};
 * letters would otherwise be dropped and distinct numbers would share one key.</p>
 *
 * @author AddressBook Team
 * @since 1.0.0
 */
public final class ContactKeys {

    private static final String PHONE_SEPARATORS = "+-(). ";

    private ContactKeys() {
    }

    /**
     * Computes the phone key.
     *
     * @param phone raw phone value
     * @return the key, empty when the value holds no digits or {@code +}
     * @throws IllegalArgumentException if phone is null
     */
    public static String phoneKey(String phone) {
        if (phone == null) {
            throw new IllegalArgumentException("phone cannot be null");
        }
        StringBuilder key = new StringBuilder(phone.length());
        for (int i = 0; i < phone.length(); i++) {
            char c = phone.charAt(i);
            if ((c >= '0' && c <= '9') || c == '+') {
                key.append(c);
            }
        }
        return key.toString();
    }

    /**
     * Checks that text holds only ASCII digits, {@code +} and the separators {@code -().} and space.
     *
     * @param text raw phone value or query
     * @return true when every character is a digit or an allowed separator
     * @throws IllegalArgumentException if text is null
     */
    public static boolean isPhoneText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if ((c < '0' || c > '9') && PHONE_SEPARATORS.indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Computes the email key.
     *
     * @param email raw email value
     * @return the key
     * @throws IllegalArgumentException if email is null
     */
    public static String emailKey(String email) {
        if (email == null) {
            throw new IllegalArgumentException("email cannot be null");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
