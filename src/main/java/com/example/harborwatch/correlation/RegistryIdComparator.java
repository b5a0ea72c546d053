package com.example.harborwatch.correlation;

import java.math.BigInteger;
import java.util.Comparator;

/**
 * Orders registry identifiers for tie-breaking. Integer-looking identifiers
 * (MMSI numbers, spreadsheet row ids) compare by numeric value and sort before
 * any other identifier; everything else compares lexicographically.
 */
public final class RegistryIdComparator implements Comparator<String> {

    public static final RegistryIdComparator INSTANCE = new RegistryIdComparator();

    private RegistryIdComparator() {
    }

    @Override
    public int compare(String left, String right) {
        BigInteger leftNumber = parse(left);
        BigInteger rightNumber = parse(right);
        if (leftNumber != null && rightNumber != null) {
            int byValue = leftNumber.compareTo(rightNumber);
            return byValue != 0 ? byValue : left.compareTo(right);
        }
        if (leftNumber != null) {
            return -1;
        }
        if (rightNumber != null) {
            return 1;
        }
        return left.compareTo(right);
    }

    private static BigInteger parse(String id) {
        if (id == null || id.isEmpty() || !id.chars().allMatch(ch -> Character.isDigit(ch) || ch == '-')) {
            return null;
        }
        try {
            return new BigInteger(id);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
