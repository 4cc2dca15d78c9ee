package com.jasmin.trafficshield.benchmark;

import com.jasmin.trafficshield.models.RequestEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Runs the offline detection strategies over the same batch and compares them. Each strategy
 * gets its own worker thread and time budget; one that runs out of time is reported as skipped
 * and does not hold up the others.
 */
@Slf4j
@Service
public class DetectionBenchmark {

    private final Map<String, DetectionStrategy> strategies = new LinkedHashMap<>();
    private final BenchmarkProperties props;

    public DetectionBenchmark(List<DetectionStrategy> strategies, BenchmarkProperties props) {
        for (DetectionStrategy s : strategies) {
            this.strategies.put(s.name(), s);
        }
        this.props = props;
    }

    public BenchmarkReport run(BenchmarkRequest request) {
        List<RequestEvent> events = request.getEvents();
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events must not be empty");
        }
        for (RequestEvent e : events) {
            if (e.getSourceId() == null || e.getTimestamp() == null) {
                throw new IllegalArgumentException("every event needs a sourceId and a timestamp");
            }
        }

        List<DetectionStrategy> selected = select(request.getStrategies());
        Duration window = Duration.ofSeconds(request.getWindowSeconds());
        List<StrategyResult> results = new ArrayList<>();
        for (DetectionStrategy strategy : selected) {
            results.add(runOne(strategy, events, window, request.getThreshold(), request.getAttackers()));
        }
        return new BenchmarkReport(events.size(), request.getWindowSeconds(), request.getThreshold(), results);
    }

    private List<DetectionStrategy> select(List<String> names) {
        if (names == null || names.isEmpty()) {
            return new ArrayList<>(strategies.values());
        }
        List<DetectionStrategy> out = new ArrayList<>();
        for (String name : names) {
            DetectionStrategy s = strategies.get(name);
            if (s == null) {
                throw new IllegalArgumentException("Unknown strategy: " + name + ", expected one of " + strategies.keySet());
            }
            out.add(s);
        }
        return out;
    }

    private StrategyResult runOne(DetectionStrategy strategy, List<RequestEvent> events, Duration window,
                                  int threshold, Set<String> attackers) {
        ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "benchmark-" + strategy.name());
            t.setDaemon(true);
            return t;
        });
        long start = System.nanoTime();
        Future<Set<String>> future = worker.submit(() -> strategy.detect(events, window, threshold));
        try {
            Set<String> detected = future.get(props.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            StrategyResult.StrategyResultBuilder result = StrategyResult.builder()
                    .strategy(strategy.name())
                    .status(StrategyResult.Status.COMPLETED)
                    .elapsedMillis(elapsed)
                    .detected(detected.stream().sorted().collect(Collectors.toList()));
            if (attackers != null) {
                score(result, detected, attackers);
            }
            log.info("Strategy {} flagged {} sources in {} ms", strategy.name(), detected.size(), elapsed);
            return result.build();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Strategy {} exceeded {} and was skipped", strategy.name(), props.getTimeout());
            return StrategyResult.builder()
                    .strategy(strategy.name())
                    .status(StrategyResult.Status.SKIPPED)
                    .elapsedMillis(props.getTimeout().toMillis())
                    .detected(List.of())
                    .error("Timed out after " + props.getTimeout())
                    .build();
        } catch (ExecutionException e) {
            log.error("Strategy {} failed", strategy.name(), e.getCause());
            return failed(strategy, start, String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(strategy, start, "Interrupted");
        } finally {
            worker.shutdownNow();
        }
    }

    private static StrategyResult failed(DetectionStrategy strategy, long start, String error) {
        return StrategyResult.builder()
                .strategy(strategy.name())
                .status(StrategyResult.Status.FAILED)
                .elapsedMillis(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start))
                .detected(List.of())
                .error(error)
                .build();
    }

    private static void score(StrategyResult.StrategyResultBuilder result, Set<String> detected, Set<String> actual) {
        Set<String> hits = new HashSet<>(detected);
        hits.retainAll(actual);
        double precision = (double) hits.size() / Math.max(1, detected.size());
        double recall = (double) hits.size() / Math.max(1, actual.size());
        double f1 = 2 * precision * recall / Math.max(0.001, precision + recall);
        result.precision(precision).recall(recall).f1(f1);
    }
}
