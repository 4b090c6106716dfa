package com.anthem.acctctl.core.account;

public final class AccountIds {

    private AccountIds() {
    }

    /**
     * Returns true if {@code s} is a 12-digit AWS account ID.
     */
    public static boolean isId(String s) {
        if (s == null || s.length() != 12) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
