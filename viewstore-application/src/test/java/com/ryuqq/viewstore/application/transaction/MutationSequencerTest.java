package com.ryuqq.viewstore.application.transaction;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MutationSequencer unit tests.
 *
 * <p>Tasks are driven by hand-completed futures so the ordering can be observed step by step.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
class MutationSequencerTest {

    private final MutationSequencer sequencer = new MutationSequencer();
    private final List<String> started = new ArrayList<>();

    @Test
    void submit_SecondTaskWaitsUntilFirstSettles() {
        // given
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();

        // when
        CompletableFuture<String> firstResult = sequencer.submit(() -> {
            started.add("first");
            return first;
        });
        CompletableFuture<String> secondResult = sequencer.submit(() -> {
            started.add("second");
            return second;
        });

        // then
        assertThat(started).containsExactly("first");
        assertThat(sequencer.isIdle()).isFalse();

        first.complete("one");
        assertThat(firstResult).isCompletedWithValue("one");
        assertThat(started).containsExactly("first", "second");

        second.complete("two");
        assertThat(secondResult).isCompletedWithValue("two");
        assertThat(sequencer.isIdle()).isTrue();
    }

    @Test
    void submit_FailedTaskDoesNotBlockQueue() {
        // given
        CompletableFuture<String> failing = new CompletableFuture<>();

        // when
        CompletableFuture<String> failed = sequencer.submit(() -> failing);
        CompletableFuture<String> next = sequencer.submit(() -> CompletableFuture.completedFuture("next"));
        failing.completeExceptionally(new IllegalStateException("boom"));

        // then
        assertThatThrownBy(failed::join)
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(next).isCompletedWithValue("next");
    }

    @Test
    void submit_TaskThrowingSynchronously_FailsItsResultOnly() {
        // when
        CompletableFuture<String> failed = sequencer.submit(() -> {
            throw new IllegalArgumentException("bad request");
        });
        CompletableFuture<String> next = sequencer.submit(() -> CompletableFuture.completedFuture("ok"));

        // then
        assertThatThrownBy(failed::join).hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(next).isCompletedWithValue("ok");
    }

    @Test
    void submit_FromInsideRunningTask_RunsAfterIt() {
        // given
        CompletableFuture<String> outer = new CompletableFuture<>();
        List<CompletableFuture<String>> nested = new ArrayList<>();

        // when
        sequencer.submit(() -> {
            started.add("outer");
            nested.add(sequencer.submit(() -> {
                started.add("nested");
                return CompletableFuture.completedFuture("nested");
            }));
            return outer;
        });

        // then
        assertThat(started).containsExactly("outer");
        outer.complete("outer");
        assertThat(started).containsExactly("outer", "nested");
        assertThat(nested.get(0)).isCompletedWithValue("nested");
    }

    @Test
    void submit_NullTask_Throws() {
        assertThatThrownBy(() -> sequencer.submit(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }
}
