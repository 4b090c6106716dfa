package com.anthem.acctctl.core.account;

import java.math.BigInteger;
import java.util.Comparator;
import java.util.Locale;

/**
 * Orders accounts by name the way people read them: case-insensitive, with
 * runs of digits compared by numeric value, so "test2" sorts before "test10".
 * Ties are broken by account ID.
 */
public final class NaturalOrder implements Comparator<Account> {

    public static final NaturalOrder INSTANCE = new NaturalOrder();

    private NaturalOrder() {
    }

    @Override
    public int compare(Account a, Account b) {
        int c = compareNames(nullToEmpty(a.getName()), nullToEmpty(b.getName()));
        return c != 0 ? c : a.getId().compareTo(b.getId());
    }

    public static int compareNames(String a, String b) {
        String x = a.toUpperCase(Locale.ROOT);
        String y = b.toUpperCase(Locale.ROOT);
        int i = 0;
        int j = 0;
        while (i < x.length() && j < y.length()) {
            char cx = x.charAt(i);
            char cy = y.charAt(j);
            if (isDigit(cx) && isDigit(cy)) {
                int ei = digitsEnd(x, i);
                int ej = digitsEnd(y, j);
                int c = new BigInteger(x.substring(i, ei)).compareTo(new BigInteger(y.substring(j, ej)));
                if (c != 0) {
                    return c;
                }
                i = ei;
                j = ej;
                continue;
            }
            if (cx != cy) {
                return Character.compare(cx, cy);
            }
            i++;
            j++;
        }
        return Integer.compare(x.length() - i, y.length() - j);
    }

    private static int digitsEnd(String s, int i) {
        while (i < s.length() && isDigit(s.charAt(i))) {
            i++;
        }
        return i;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
