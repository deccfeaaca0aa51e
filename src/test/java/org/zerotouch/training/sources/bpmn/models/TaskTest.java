package org.zerotouch.training.sources.bpmn.models;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    private static String code(String name) {
        return new Task("T", name, "", List.of(), List.of()).transactionCode();
    }

    @Test
    void shouldExtractBracketedTransactionCode() {
        assertEquals("ME51N", code("Create PR (ME51N)"));
        assertEquals("MIGO", code("(MIGO) Post goods receipt"));
    }

    @Test
    void shouldTakeFirstMatchingCode() {
        assertEquals("ME21N", code("Post (ME21N) then (ME29N)"));
        assertEquals("VA01", code("Order (x) entry (VA01)"));
    }

    @Test
    void shouldReturnEmptyWhenNoCode() {
        assertEquals("", code("Approve requisition"));
        assertEquals("", code("Lowercase (me51n)"));
        assertEquals("", code("Too short (A)"));
        assertEquals("", code("Too long (ABCDEFGHIJK)"));
        assertEquals("", code(null));
    }
}
