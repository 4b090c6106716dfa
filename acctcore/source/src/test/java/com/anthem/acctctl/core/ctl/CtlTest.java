package com.anthem.acctctl.core.ctl;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class CtlTest {

    @Test
    void constructor_shouldNormalizeNullsAndTags() {
        Ctl ctl = new Ctl(null, null, List.of("z", "a", "z"));

        assertEquals("", ctl.getOwner());
        assertEquals("", ctl.getDesc());
        assertEquals(List.of("a", "z"), ctl.getTags());
        assertFalse(ctl.isOwned());
    }

    @Test
    void tags_shouldNotBeShared() {
        Ctl ctl = new Ctl("", "", List.of("a"));

        assertThrows(UnsupportedOperationException.class, () -> ctl.getTags().add("b"));
    }

    @Test
    void merge_shouldReturnCurrentWhenNothingChangedLocally() {
        Ctl ref = new Ctl("", "old", List.of("a", "b"));
        Ctl cur = new Ctl("bob", "new", List.of("b", "c"));

        assertEquals(cur, ref.merge(cur, ref));
    }

    @Test
    void merge_shouldApplyLocalChangesOnTopOfCurrent() {
        // Given: local added "x" and removed "a", someone else added "c"
        Ctl ref = new Ctl("", "desc", List.of("a", "b"));
        Ctl want = new Ctl("alice", "desc", List.of("b", "x"));
        Ctl cur = new Ctl("", "changed", List.of("a", "b", "c"));

        // When
        Ctl merged = want.merge(cur, ref);

        // Then
        assertEquals("alice", merged.getOwner());
        assertEquals("changed", merged.getDesc());
        assertThat(merged.getTags()).containsExactly("b", "c", "x");
    }

    @Test
    void merge_shouldKeepLocalOwnerChangeEvenIfCurrentDiffers() {
        Ctl ref = Ctl.EMPTY;
        Ctl want = Ctl.EMPTY.withOwner("alice");
        Ctl cur = Ctl.EMPTY.withOwner("bob");

        assertEquals("alice", want.merge(cur, ref).getOwner());
    }
}
