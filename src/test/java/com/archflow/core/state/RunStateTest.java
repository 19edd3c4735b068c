package com.archflow.core.state;

import com.archflow.core.model.DesignBundle;
import com.archflow.core.model.DesignRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RunStateTest {

    private RunState state;

    @BeforeEach
    void setUp() {
        state = new RunState("ARCH-2026-0001", "fp", new DesignRequest("Build a web app", null));
    }

    @Test
    @DisplayName("effective requirements prefer the refined text")
    void effectiveRequirements() {
        assertEquals("Build a web app", state.effectiveRequirements());

        state.apply(StateDelta.builder().field(DesignField.REFINED_REQUIREMENTS, "A public web app").build());

        assertEquals("A public web app", state.effectiveRequirements());
    }

    @Test
    @DisplayName("apply merges fields, status, clarification and transcript")
    void apply() {
        state.apply(StateDelta.builder()
                .field(DesignField.AUDIT_REPORT, "APPROVED")
                .status(RunStatus.APPROVED)
                .clarificationNeeded(false)
                .transcript("audit", "Chief Auditor", "APPROVED")
                .build());

        assertEquals("APPROVED", state.outputOrEmpty(DesignField.AUDIT_REPORT));
        assertEquals(RunStatus.APPROVED, state.status());
        assertEquals(1, state.transcript().size());
        assertTrue(state.transcript().render().contains("**Chief Auditor:**"));
    }

    @Test
    @DisplayName("recordRevision counts passes and keeps non-blank feedback")
    void recordRevision() {
        state.recordRevision("fix the database");
        state.recordRevision("  ");

        assertEquals(2, state.revisionCount());
        assertEquals(java.util.List.of("fix the database"), state.revisionFeedback());
    }

    @Test
    @DisplayName("historical context is loaded once")
    void historicalContextMemoized() {
        var loads = new AtomicInteger();

        state.historicalContext(() -> "history " + loads.incrementAndGet());
        String second = state.historicalContext(() -> "history " + loads.incrementAndGet());

        assertEquals("history 1", second);
        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("a completed run's bundle reports an approved audit")
    void bundle() {
        state.apply(StateDelta.builder().field(DesignField.DESIGN, "design").build());
        state.status(RunStatus.COMPLETE);

        DesignBundle bundle = state.toBundle();

        assertEquals("approved", bundle.auditStatus());
        assertEquals("design", bundle.design());
        assertEquals("", bundle.terraformCode());
        assertNull(bundle.clarifyingQuestions());
    }
}
