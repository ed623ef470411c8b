package com.filterbench.engine;

import com.filterbench.concurrent.RunContext;
import com.filterbench.model.FilterResult;
import com.filterbench.model.FilterTask;
import com.filterbench.model.RunOutcome;
import com.filterbench.service.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Baseline: one task at a time on the calling thread, results in submission
 * order. Its mean time is the speedup denominator.
 */
@Component
public class SequentialStrategy implements ExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SequentialStrategy.class);

    private final ImageProcessor processor;

    public SequentialStrategy(ImageProcessor processor) {
        this.processor = processor;
    }

    @Override
    public StrategyType getType() {
        return StrategyType.SEQUENTIAL;
    }

    @Override
    public RunOutcome execute(List<FilterTask> tasks, RunContext context) {
        long start = System.nanoTime();
        List<FilterResult> results = new ArrayList<>(tasks.size());
        for (FilterTask task : tasks) {
            FilterResult result = processor.execute(task);
            context.record(result);
            results.add(result);
        }
        double elapsed = (System.nanoTime() - start) / 1e9;
        log.info("Sequential run of {} task(s) finished in {} s", tasks.size(), String.format("%.3f", elapsed));
        return new RunOutcome(getType(), results, elapsed, 1);
    }
}
