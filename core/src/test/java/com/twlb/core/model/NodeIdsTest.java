package com.twlb.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeIdsTest {

    @Test
    void formatsAndParses() {
        assertEquals("node-12", NodeIds.format(12));
        assertEquals(12, NodeIds.parse("node-12"));
    }

    @Test
    void rangeIsOrderedFromOne() {
        assertEquals(List.of("node-1", "node-2", "node-3"), NodeIds.range(3));
        assertTrue(NodeIds.range(0).isEmpty());
    }

    @Test
    void rejectsMalformedIds() {
        assertThrows(IllegalArgumentException.class, () -> NodeIds.parse("node-X"));
        assertThrows(IllegalArgumentException.class, () -> NodeIds.parse("socket-1"));
        assertThrows(IllegalArgumentException.class, () -> NodeIds.parse("node-0"));
        assertThrows(IllegalArgumentException.class, () -> NodeIds.format(0));
    }
}
