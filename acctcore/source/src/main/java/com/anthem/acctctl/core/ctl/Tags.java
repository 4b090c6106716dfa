package com.anthem.acctctl.core.ctl;

import com.anthem.acctctl.core.exception.AcctCtlException;
import com.anthem.acctctl.core.exception.ErrorKind;
import com.anthem.acctctl.core.spec.SpecEntry;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Operations on account tag sets. Tag lists are always sorted, unique and
 * immutable.
 */
public final class Tags {

    /** Names with special meaning in account specs; never valid as tags. */
    public static final Set<String> RESERVED = Set.of("owner", "err");

    private Tags() {
    }

    /**
     * Returns a sorted, de-duplicated, immutable copy of {@code tags}.
     */
    public static List<String> normalize(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new TreeSet<>(tags));
    }

    /**
     * Returns the changes that turn {@code ref} into {@code want}.
     */
    public static Diff diff(Collection<String> want, Collection<String> ref) {
        TreeSet<String> set = new TreeSet<>(want);
        set.removeAll(ref);
        TreeSet<String> clr = new TreeSet<>(ref);
        clr.removeAll(want);
        return new Diff(List.copyOf(set), List.copyOf(clr));
    }

    /**
     * Adds {@code diff.set} to and removes {@code diff.clr} from {@code base}.
     * Setting wins if a tag appears in both.
     */
    public static List<String> apply(Collection<String> base, Diff diff) {
        TreeSet<String> out = new TreeSet<>(base);
        out.removeAll(diff.getClr());
        out.addAll(diff.getSet());
        return List.copyOf(out);
    }

    /**
     * Parses a comma-separated tag list such as {@code "a,!b,c=false"} into
     * disjoint sets of tags to set and to clear. The last occurrence of a tag
     * decides its state.
     *
     * @throws AcctCtlException of kind INVALID_TAG if any entry is malformed
     */
    public static Diff parse(String s) {
        if (s == null || s.isEmpty()) {
            return Diff.EMPTY;
        }
        Map<String, Boolean> neg = new LinkedHashMap<>();
        for (String t : s.split(",", -1)) {
            SpecEntry e = SpecEntry.parse(t);
            if (!e.getValue().isEmpty() || !isValid(e.getName())) {
                throw new AcctCtlException(ErrorKind.INVALID_TAG, "invalid tag \"" + t + "\"");
            }
            neg.put(e.getName(), e.isNegated());
        }
        TreeSet<String> set = new TreeSet<>();
        TreeSet<String> clr = new TreeSet<>();
        neg.forEach((name, n) -> (n ? clr : set).add(name));
        return new Diff(List.copyOf(set), List.copyOf(clr));
    }

    /**
     * Returns true if {@code name} is a valid, non-reserved tag name: a letter
     * followed by letters, digits, '-', '.' or '_'.
     */
    public static boolean isValid(String name) {
        if (name == null || name.isEmpty() || RESERVED.contains(name) || !isLetter(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!isLetter(c) && !(c >= '0' && c <= '9') && c != '-' && c != '.' && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    /**
     * Tags to set and tags to clear.
     */
    public static final class Diff {

        public static final Diff EMPTY = new Diff(List.of(), List.of());

        private final List<String> set;
        private final List<String> clr;

        public Diff(List<String> set, List<String> clr) {
            this.set = normalize(set);
            this.clr = normalize(clr);
        }

        public List<String> getSet() {
            return set;
        }

        public List<String> getClr() {
            return clr;
        }

        public boolean isEmpty() {
            return set.isEmpty() && clr.isEmpty();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Diff && set.equals(((Diff) o).set) && clr.equals(((Diff) o).clr);
        }

        @Override
        public int hashCode() {
            return 31 * set.hashCode() + clr.hashCode();
        }

        @Override
        public String toString() {
            return "Diff{set=" + set + ", clr=" + clr + "}";
        }
    }
}
