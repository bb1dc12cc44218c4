package com.demoBank.atmDemo.util;

/**
 * Masks card numbers, account numbers and identifiers before they reach logs or clients.
 */
public class SensitiveDataMasker {

    private SensitiveDataMasker() {}

    /**
     * Masks a PAN or account number down to its last four digits (e.g., "****1111").
     *
     * @param number Full card or account number
     * @return Masked number
     */
    public static String maskNumber(String number) {
        if (number == null || number.length() <= 4) {
            return "****";
        }
        return "****" + number.substring(number.length() - 4);
    }

    /**
     * Masks an identifier for logging. Shows first 2 and last 2 characters.
     *
     * @param id The identifier to mask
     * @return Masked identifier (e.g., "C1****01")
     */
    public static String maskId(String id) {
        if (id == null || id.length() <= 4) {
            return "****";
        }
        return id.substring(0, 2) + "****" + id.substring(id.length() - 2);
    }
}
