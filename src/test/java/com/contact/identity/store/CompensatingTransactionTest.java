package com.contact.identity.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompensatingTransactionTest {

    @Test
    void committedTransaction_noCompensationsRun() {
        List<String> undone = new ArrayList<>();
        try (CompensatingTransaction tx = new CompensatingTransaction()) {
            tx.execute("step1", () -> {}, () -> undone.add("step1"));
            tx.execute("step2", () -> {}, () -> undone.add("step2"));
            tx.commit();
        }
        assertTrue(undone.isEmpty());
    }

    @Test
    void closedWithoutCommit_compensationsRunInReverse() {
        List<String> undone = new ArrayList<>();
        try (CompensatingTransaction tx = new CompensatingTransaction()) {
            tx.execute("step1", () -> {}, () -> undone.add("step1"));
            tx.execute("step2", () -> {}, () -> undone.add("step2"));
            tx.execute("step3", () -> {}, () -> undone.add("step3"));
        }
        assertEquals(List.of("step3", "step2", "step1"), undone);
    }

    @Test
    void failingStep_rollsBackEarlierStepsAndRethrows() {
        List<String> undone = new ArrayList<>();
        CompensatingTransaction tx = new CompensatingTransaction();
        tx.execute("step1", () -> {}, () -> undone.add("step1"));

        RuntimeException failure = assertThrows(RuntimeException.class, () ->
                tx.execute("step2", () -> { throw new IllegalStateException("boom"); }, () -> undone.add("step2")));

        assertEquals("boom", failure.getMessage());
        assertEquals(List.of("step1"), undone);
        assertEquals(0, tx.pendingCompensations());
    }

    @Test
    void failingCompensation_remainingCompensationsStillRun() {
        List<String> undone = new ArrayList<>();
        try (CompensatingTransaction tx = new CompensatingTransaction()) {
            tx.execute("step1", () -> {}, () -> undone.add("step1"));
            tx.execute("step2", () -> {}, () -> { throw new IllegalStateException("undo failed"); });
            tx.execute("step3", () -> {}, () -> undone.add("step3"));
        }
        assertEquals(List.of("step3", "step1"), undone);
    }

    @Test
    void valueProducingStep_compensationReceivesValue() {
        List<Integer> undone = new ArrayList<>();
        try (CompensatingTransaction tx = new CompensatingTransaction()) {
            int created = tx.execute("create", () -> 42, undone::add);
            assertEquals(42, created);
            assertEquals(1, tx.pendingCompensations());
        }
        assertEquals(List.of(42), undone);
    }

    @Test
    void finishedTransaction_rejectsFurtherSteps() {
        CompensatingTransaction tx = new CompensatingTransaction();
        tx.commit();
        assertTrue(tx.isCommitted());
        assertThrows(IllegalStateException.class, () -> tx.execute("late", () -> {}, () -> {}));
        assertThrows(IllegalStateException.class, tx::commit);
    }
}
