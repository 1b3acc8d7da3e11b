package io.github.sparkrew.cpgslice.udf_slicer.utils;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for IssueLists class.
 */
class IssueListsTest {

    @Test
    void testCapped_UnderLimit() {
        assertEquals(List.of("a", "b"), IssueLists.capped(List.of("a", "b"), 2));
    }

    @Test
    void testCapped_OverLimit() {
        assertEquals(List.of("a", "b", "... and 3 more"), IssueLists.capped(List.of("a", "b", "c", "d", "e"), 2));
    }

    @Test
    void testCapped_NonPositiveKeepsAll() {
        assertEquals(List.of("a", "b", "c"), IssueLists.capped(List.of("a", "b", "c"), 0));
    }

    @Test
    void testCapped_DefaultKeepsAll() {
        List<String> issues = IntStream.range(0, 120).mapToObj(i -> "issue " + i).toList();

        assertEquals(issues, IssueLists.capped(issues, IssueLists.DEFAULT_MAX_ISSUES));
    }

    @Test
    void testJoinEdgeTypes() {
        assertEquals("CFG_CALL", CpgNames.joinEdgeTypes(CpgNames.DEFAULT_EDGE_TYPES));
    }
}
