package com.baykanat.funnel.domain.service;

import com.baykanat.funnel.domain.model.CompletionSets;
import com.baykanat.funnel.domain.model.StepEvent;
import com.baykanat.funnel.domain.model.VisitorProgress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static com.baykanat.funnel.domain.service.TimelineAssemblerTest.event;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FunnelMatcher.
 *
 * <p>Verifies the expected-step cursor:
 * <ul>
 *   <li>Only the expected step advances; out-of-order events are ignored</li>
 *   <li>Repeated steps are counted once</li>
 *   <li>Completion sets are monotonic and deterministic</li>
 * </ul>
 */
class FunnelMatcherTest {

    private final FunnelMatcher matcher = new FunnelMatcher();
    private final TimelineAssembler assembler = new TimelineAssembler();

    @Test
    @DisplayName("In-order events complete every step")
    void inOrderCompletesAllSteps() {
        VisitorProgress progress = matcher.match("a", List.of(event(1, "a", 0), event(2, "a", 10), event(3, "a", 20)), 3);

        assertThat(progress.completedSteps()).isEqualTo(3);
        assertThat(progress.completedAt(3)).isEqualTo(event(3, "a", 20).getOccurredAt());
    }

    @Test
    @DisplayName("Later step before its predecessor is ignored")
    void outOfOrderStepIgnored() {
        VisitorProgress progress = matcher.match("a", List.of(event(2, "a", 0), event(1, "a", 5), event(3, "a", 9)), 3);

        assertThat(progress.completedSteps()).isEqualTo(1);
        assertThat(progress.hasCompleted(2)).isFalse();
    }

    @Test
    @DisplayName("Repeated step keeps the first completion time")
    void repeatedStepCountedOnce() {
        VisitorProgress progress = matcher.match("a",
                List.of(event(1, "a", 0), event(1, "a", 3), event(2, "a", 7), event(2, "a", 8)), 2);

        assertThat(progress.getCompletionTimes())
                .containsExactly(event(1, "a", 0).getOccurredAt(), event(2, "a", 7).getOccurredAt());
    }

    @Test
    @DisplayName("Visitor without step 1 is absent from every set")
    void noEntryNoMembership() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(event(2, "a", 0), event(3, "a", 1))), 3);

        assertThat(sets.users(1)).isZero();
        assertThat(sets.users(2)).isZero();
        assertThat(sets.progress("a")).isNull();
    }

    @Test
    @DisplayName("Step counts never increase along the funnel")
    void monotonicNonIncrease() {
        CompletionSets sets = matcher.matchAll(assembler.assemble(List.of(
                event(1, "a", 0), event(2, "a", 1), event(3, "a", 2),
                event(1, "b", 0), event(3, "b", 1),
                event(1, "c", 0), event(2, "c", 5),
                event(2, "d", 0), event(3, "d", 1))), 3);

        assertThat(sets.users(1)).isEqualTo(3);
        assertThat(sets.users(2)).isEqualTo(2);
        assertThat(sets.users(3)).isEqualTo(1);
        assertThat(sets.visitors(2)).isSubsetOf(sets.visitors(1));
        assertThat(sets.visitors(3)).isSubsetOf(sets.visitors(2));
    }

    @Test
    @DisplayName("Same unsorted input twice yields identical completion sets")
    void deterministicForIdenticalInput() {
        List<StepEvent> rows = List.of(
                event(3, "a", 9), event(1, "a", 0), event(2, "a", 4),
                event(2, "b", 2), event(1, "b", 2), event(3, "b", 3),
                event(1, "c", 6), event(2, "c", 8), event(1, "c", 1));

        CompletionSets first = matcher.matchAll(assembler.assemble(rows), 3);
        CompletionSets second = matcher.matchAll(assembler.assemble(rows), 3);

        for (int step = 1; step <= 3; step++) {
            assertThat(second.visitors(step)).containsExactlyElementsOf(first.visitors(step));
        }
        assertThat(second.getProgress()).isEqualTo(first.getProgress());
        // b: step 2 arrives before step 1 at the same instant, so only step 1 counts
        assertThat(first.progress("b").completedSteps()).isEqualTo(1);
    }

    @Test
    @DisplayName("Row order does not matter when timestamps are distinct")
    void orderIndependentWithoutTies() {
        List<StepEvent> rows = new ArrayList<>(List.of(
                event(1, "a", 0), event(2, "a", 4), event(3, "a", 9),
                event(1, "c", 1), event(1, "c", 6), event(2, "c", 8)));

        CompletionSets first = matcher.matchAll(assembler.assemble(rows), 3);
        Collections.shuffle(rows, new Random(42));
        CompletionSets second = matcher.matchAll(assembler.assemble(rows), 3);

        for (int step = 1; step <= 3; step++) {
            assertThat(second.visitors(step)).containsExactlyInAnyOrderElementsOf(first.visitors(step));
        }
        assertThat(second.getProgress()).isEqualTo(first.getProgress());
    }
}
