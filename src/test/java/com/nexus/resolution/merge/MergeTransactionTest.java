package com.nexus.resolution.merge;

import com.nexus.resolution.graph.GraphWriteException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the compensating merge transaction.
 */
class MergeTransactionTest {

    @Test
    void successfulTransaction_noCompensationsRun() {
        List<String> log = new ArrayList<>();

        try (MergeTransaction tx = new MergeTransaction()) {
            tx.execute("save target", () -> log.add("save"), () -> log.add("restore target"));
            tx.execute("redirect source", () -> log.add("redirect"), () -> log.add("restore source"));
            tx.markSuccess();
        }

        assertEquals(List.of("save", "redirect"), log);
    }

    @Test
    void failedStep_compensatesEarlierStepsInReverseAndRethrows() {
        List<String> log = new ArrayList<>();

        GraphWriteException thrown = assertThrows(GraphWriteException.class, () -> {
            try (MergeTransaction tx = new MergeTransaction()) {
                tx.execute("save target", () -> log.add("save"), () -> log.add("restore target"));
                tx.execute("repoint", () -> log.add("repoint"), () -> log.add("restore edges"));
                tx.execute("redirect source", () -> {
                    throw new GraphWriteException("write failed");
                }, () -> log.add("restore source"));
            }
        });

        assertEquals("write failed", thrown.getMessage());
        assertEquals(List.of("save", "repoint", "restore edges", "restore target"), log);
    }

    @Test
    void closedWithoutSuccess_runsAllCompensations() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> log.add("comp2"));
        tx.close();

        assertEquals(List.of("op1", "op2", "comp2", "comp1"), log);
    }

    @Test
    void compensationFailure_continuesRemainingCompensations() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.execute("step2", () -> log.add("op2"), () -> {
            throw new GraphWriteException("compensation failed");
        });
        tx.execute("step3", () -> log.add("op3"), () -> log.add("comp3"));
        tx.close();

        assertEquals(List.of("op1", "op2", "op3", "comp3", "comp1"), log);
    }

    @Test
    void isSuccess_reflectsState() {
        MergeTransaction tx = new MergeTransaction();
        assertFalse(tx.isSuccess());
        tx.markSuccess();
        assertTrue(tx.isSuccess());
        tx.close();
    }

    @Test
    void executeAfterClose_throwsIllegalState() {
        MergeTransaction tx = new MergeTransaction();
        tx.markSuccess();
        tx.close();

        assertThrows(IllegalStateException.class, () -> tx.execute("step", () -> {}, () -> {}));
    }

    @Test
    void closingTwice_compensatesOnce() {
        List<String> log = new ArrayList<>();

        MergeTransaction tx = new MergeTransaction();
        tx.execute("step1", () -> log.add("op1"), () -> log.add("comp1"));
        tx.close();
        tx.close();

        assertEquals(List.of("op1", "comp1"), log);
    }
}
