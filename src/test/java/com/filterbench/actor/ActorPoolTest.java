package com.filterbench.actor;

import com.filterbench.TestImages;
import com.filterbench.engine.StrategyType;
import com.filterbench.filter.FilterTransforms;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.FilterType;
import com.filterbench.service.ImageProcessor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ActorPoolTest {

    @TempDir
    Path tempDir;

    @Test
    void dealsTasksRoundRobin() throws Exception {
        List<FilterTask> tasks = TestImages.tasks(TestImages.writeBatch(tempDir, 10), FilterType.EMBOSS,
                tempDir.resolve("out"), StrategyType.ACTOR_POOL);
        ActorPool pool = new ActorPool(3, new ImageProcessor(FilterTransforms.defaults(), 0), 50,
                ShutdownPolicy.DRAIN);
        pool.start();
        AtomicInteger callbacks = new AtomicInteger();
        List<FilterResult> results;
        try {
            pool.dispatch(tasks);
            results = pool.collect(tasks.size(), r -> callbacks.incrementAndGet());
        } finally {
            pool.stop();
            assertThat(pool.awaitTermination(10_000)).isTrue();
        }

        assertThat(pool.getActors()).extracting(ProcessingActor::getAssignedCount)
                .containsExactly(4, 3, 3);
        assertThat(pool.getActors()).extracting(ProcessingActor::getProcessedCount)
                .containsExactly(4, 3, 3);
        assertThat(results).hasSize(10);
        assertThat(callbacks.get()).isEqualTo(10);

        List<String> expected = new ArrayList<>();
        tasks.forEach(t -> expected.add(t.getSourcePath()));
        assertThat(results).extracting(FilterResult::getOriginal).containsExactlyInAnyOrderElementsOf(expected);
    }

    @Test
    void moreActorsThanTasksLeavesSomeIdle() throws Exception {
        List<FilterTask> tasks = TestImages.tasks(TestImages.writeBatch(tempDir, 2), FilterType.BLUR,
                tempDir.resolve("out"), StrategyType.ACTOR_POOL);
        ActorPool pool = new ActorPool(4, new ImageProcessor(FilterTransforms.defaults(), 0), 50,
                ShutdownPolicy.DRAIN);
        pool.start();
        try {
            pool.dispatch(tasks);
            assertThat(pool.collect(2, r -> { })).hasSize(2);
        } finally {
            pool.stop();
            pool.awaitTermination(10_000);
        }
        assertThat(pool.getActors()).extracting(ProcessingActor::getAssignedCount)
                .containsExactly(1, 1, 0, 0);
    }

    @Test
    void rejectsEmptyPool() {
        assertThatThrownBy(() -> new ActorPool(0, new ImageProcessor(FilterTransforms.defaults(), 0), 50,
                ShutdownPolicy.DRAIN)).isInstanceOf(IllegalArgumentException.class);
    }
}
