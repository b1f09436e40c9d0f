package com.example.aggregates;

import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Counts how many records contain each combo, for every length from 1 up to a limit.
 * <p>
 * Each length is counted in its own pass. Within a pass the records are split into
 * contiguous partitions, one task per partition on a fixed thread pool; a task only
 * enumerates combos and returns them. The calling thread merges the partitions in
 * partition order into a single count map, so the resulting table is identical for
 * every parallelism, including its iteration order.
 * <p>
 * A pass holds up to {@code sum(C(size, length))} combos in memory at once, which is
 * exponential in record width. Every pass is checked against a combo budget before
 * any task is scheduled.
 */
public class ComboCounter {

    private static final Logger LOG = LoggerFactory.getLogger(ComboCounter.class);

    /** Budget value that disables the combo budget check. */
    public static final long UNLIMITED = -1;

    /**
     * Counts combos of every length in {@code [1, lengthLimit]} without a combo budget.
     *
     * @see #countAll(List, int, int, long)
     */
    public static CountTable countAll(List<Record> records, int lengthLimit, int parallelism) {
        return countAll(records, lengthLimit, parallelism, UNLIMITED);
    }

    /**
     * Counts combos of every length in {@code [1, lengthLimit]}.
     *
     * @param records     the normalized rows
     * @param lengthLimit the longest combo length to count; a negative value means the
     *                    size of the widest record
     * @param parallelism number of worker threads; {@code <= 0} uses every available processor
     * @param comboBudget the most combos one length pass may generate; {@code <= 0} disables the check
     * @return counts for every length from 1 to the effective limit, each length present
     *         even when it has no combos
     * @throws CombinatorialExplosionException if a pass exceeds {@code comboBudget} or runs out of memory
     */
    public static CountTable countAll(List<Record> records, int lengthLimit, int parallelism, long comboBudget) {
        int limit = lengthLimit < 0 ? maxRecordSize(records) : lengthLimit;
        int workers = effectiveParallelism(parallelism, records.size());

        CountTable table = new CountTable();
        if (limit == 0) {
            return table;
        }

        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            for (int length = 1; length <= limit; length++) {
                countLength(pool, workers, records, length, comboBudget, table);
            }
        } finally {
            pool.shutdownNow();
        }
        return table;
    }

    /**
     * Counts combos of a single length.
     */
    public static CountTable countLength(List<Record> records, int length, int parallelism) {
        int workers = effectiveParallelism(parallelism, records.size());
        CountTable table = new CountTable();
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            countLength(pool, workers, records, length, UNLIMITED, table);
        } finally {
            pool.shutdownNow();
        }
        return table;
    }

    private static void countLength(ExecutorService pool, int workers, List<Record> records, int length,
                                    long comboBudget, CountTable table) {
        long estimate = estimateComboCount(records, length);
        if (comboBudget > 0 && estimate > comboBudget) {
            throw new CombinatorialExplosionException(length, estimate, comboBudget);
        }
        LOG.info("Counting combos of length {} ({} combos from {} records)", length, estimate, records.size());
        table.addLength(length);

        List<Callable<List<Combo>>> tasks = new ArrayList<>();
        int partitionSize = (records.size() + workers - 1) / workers;
        for (int start = 0; start < records.size(); start += partitionSize) {
            List<Record> partition = records.subList(start, Math.min(start + partitionSize, records.size()));
            tasks.add(() -> enumeratePartition(partition, length));
        }
        LOG.debug("Length {}: {} partitions of up to {} records", length, tasks.size(), partitionSize);

        List<Future<List<Combo>>> futures;
        try {
            futures = pool.invokeAll(tasks);
            for (Future<List<Combo>> future : futures) {
                for (Combo combo : future.get()) {
                    table.increment(combo, 1);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while counting combos of length " + length, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OutOfMemoryError) {
                throw new CombinatorialExplosionException(length, estimate, cause);
            }
            throw new IllegalStateException("Failed counting combos of length " + length, cause);
        } catch (OutOfMemoryError e) {
            throw new CombinatorialExplosionException(length, estimate, e);
        }
    }

    // runs on a worker: no shared state is touched
    private static List<Combo> enumeratePartition(List<Record> partition, int length) {
        List<Combo> combos = new ArrayList<>();
        for (Record record : partition) {
            combos.addAll(ComboEnumerator.enumerate(record, length));
        }
        return combos;
    }

    /**
     * @return the number of combos of {@code length} the records generate, that is the sum
     *         of {@code C(record.size(), length)}; saturates at {@link Long#MAX_VALUE}
     */
    public static long estimateComboCount(List<Record> records, int length) {
        if (length <= 0) {
            return 0;
        }
        long total = 0;
        for (Record record : records) {
            if (record.size() < length) {
                continue;
            }
            long combos;
            try {
                combos = CombinatoricsUtils.binomialCoefficient(record.size(), length);
            } catch (MathArithmeticException e) {
                return Long.MAX_VALUE;
            }
            if (total > Long.MAX_VALUE - combos) {
                return Long.MAX_VALUE;
            }
            total += combos;
        }
        return total;
    }

    public static int maxRecordSize(List<Record> records) {
        int max = 0;
        for (Record record : records) {
            max = Math.max(max, record.size());
        }
        return max;
    }

    /**
     * Resolves the worker count: 0 or below means every available processor, and there are
     * never more workers than records (but always at least one).
     */
    static int effectiveParallelism(int parallelism, int recordCount) {
        int requested = parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
        return Math.min(requested, Math.max(1, recordCount));
    }
}
