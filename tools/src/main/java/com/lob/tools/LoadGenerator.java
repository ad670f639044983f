package com.lob.tools;

import com.lob.common.BookConfig;
import com.lob.common.LatencyStats;
import com.lob.engine.book.LimitView;
import com.lob.engine.book.Order;
import com.lob.engine.book.OrderBook;
import com.lob.engine.book.OrderBookException;
import com.lob.protocol.RejectReason;
import com.lob.protocol.Side;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.agrona.concurrent.NanoClock;
import org.agrona.concurrent.SystemNanoClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process load generator. Hammers one {@link OrderBook} from several threads with
 * new orders and cancels, measures per-call latency and checks the book's integrity
 * once all threads are done.
 *
 * Bids rest below and asks above {@code loadBasePrice}, so the book never crosses.
 * Every worker owns a disjoint id range and also re-cancels ids it already cancelled
 * to exercise the not-found path.
 *
 * Usage:
 *   java -jar loadgen-fat.jar [config-path]
 */
public final class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private static final int STALE_CANCEL_EVERY = 64;

    /** Totals of one run. {@code resting == accepted - cancelled} on a consistent book. */
    public record Result(long accepted, long cancelled, long notFound, Map<RejectReason, Long> rejects,
                         int resting, LimitView bestBid, LimitView bestAsk, long elapsedNanos) {}

    private final BookConfig cfg;
    private final OrderBook book;
    private final NanoClock clock;

    private final LatencyStats newOrderStats = new LatencyStats("new-order");
    private final LatencyStats cancelStats   = new LatencyStats("cancel");

    private final LongAdder accepted  = new LongAdder();
    private final LongAdder cancelled = new LongAdder();
    private final Map<RejectReason, LongAdder> rejects = new EnumMap<>(RejectReason.class);

    public LoadGenerator(BookConfig cfg) {
        this(cfg, new OrderBook(cfg), SystemNanoClock.INSTANCE);
    }

    LoadGenerator(BookConfig cfg, OrderBook book, NanoClock clock) {
        this.cfg = cfg;
        this.book = book;
        this.clock = clock;
        for (RejectReason r : RejectReason.values()) rejects.put(r, new LongAdder());
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        BookConfig cfg = BookConfig.load(configPath);
        Result result = new LoadGenerator(cfg).run();
        printResult(result);
    }

    public Result run() throws Exception {
        log.info("Starting load: threads={} ordersPerThread={} cancelRatio={} band={}@{}",
                cfg.loadThreads, cfg.loadOrdersPerThread, cfg.loadCancelRatio, cfg.loadPriceBand, cfg.loadBasePrice);

        ScheduledExecutorService metrics = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "loadgen-metrics");
            t.setDaemon(true);
            return t;
        });
        if (cfg.metricsIntervalSecs > 0) {
            metrics.scheduleAtFixedRate(this::logMetrics,
                    cfg.metricsIntervalSecs, cfg.metricsIntervalSecs, TimeUnit.SECONDS);
        }

        ExecutorService workers = Executors.newFixedThreadPool(cfg.loadThreads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>(cfg.loadThreads);
        long begin;
        try {
            for (int t = 0; t < cfg.loadThreads; t++) {
                int worker = t;
                futures.add(workers.submit(() -> {
                    start.await();
                    runWorker(worker);
                    return null;
                }));
            }
            begin = clock.nanoTime();
            start.countDown();
            for (Future<?> f : futures) f.get();
        } finally {
            workers.shutdownNow();
            metrics.shutdownNow();
        }
        long elapsed = clock.nanoTime() - begin;

        book.verifyIntegrity();
        logMetrics();

        Map<RejectReason, Long> rejectCounts = new EnumMap<>(RejectReason.class);
        rejects.forEach((reason, count) -> rejectCounts.put(reason, count.sum()));
        Result result = new Result(accepted.sum(), cancelled.sum(), rejectCounts.get(RejectReason.ORDER_NOT_FOUND),
                rejectCounts, book.restingOrderCount(), book.bestLiveBid(), book.bestLiveAsk(), elapsed);
        log.info("Load complete in {} ms: accepted={} cancelled={} resting={}",
                TimeUnit.NANOSECONDS.toMillis(elapsed), result.accepted(), result.cancelled(), result.resting());
        return result;
    }

    private void runWorker(int worker) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        long firstId = (long) worker * cfg.loadOrdersPerThread + 1;
        LongArrayList mine = new LongArrayList();
        long lastCancelled = 0;

        for (int i = 0; i < cfg.loadOrdersPerThread; i++) {
            long id = firstId + i;
            Side side = rnd.nextBoolean() ? Side.BUY : Side.SELL;
            long offset = 1 + rnd.nextInt(cfg.loadPriceBand);
            long price = side == Side.BUY ? cfg.loadBasePrice - offset : cfg.loadBasePrice + offset;
            long qty = 1 + rnd.nextInt(1_000);

            long t0 = clock.nanoTime();
            try {
                book.onNewOrder(id, side, qty, price, t0, t0);
                accepted.increment();
                mine.add(id);
            } catch (OrderBookException e) {
                rejects.get(e.reason()).increment();
            }
            newOrderStats.record(clock.nanoTime() - t0);

            if (!mine.isEmpty() && rnd.nextDouble() < cfg.loadCancelRatio) {
                long victim = mine.removeLong(rnd.nextInt(mine.size()));
                if (cancel(victim)) lastCancelled = victim;
            }
            if (lastCancelled != 0 && i % STALE_CANCEL_EVERY == 0) {
                cancel(lastCancelled);
            }
        }
    }

    private boolean cancel(long id) {
        long t0 = clock.nanoTime();
        Order o = book.onCancel(id);
        cancelStats.record(clock.nanoTime() - t0);
        if (o == null) {
            rejects.get(RejectReason.ORDER_NOT_FOUND).increment();
            return false;
        }
        cancelled.increment();
        return true;
    }

    private void logMetrics() {
        newOrderStats.logAndReset();
        cancelStats.logAndReset();
    }

    private static void printResult(Result r) {
        System.out.printf("%n=== Load Generator Results ===%n");
        System.out.printf("Accepted:    %d%n", r.accepted());
        System.out.printf("Cancelled:   %d%n", r.cancelled());
        System.out.printf("Not found:   %d%n", r.notFound());
        System.out.printf("Resting:     %d%n", r.resting());
        System.out.printf("Rejects:     %s%n", r.rejects());
        System.out.printf("Best bid:    %s%n", r.bestBid());
        System.out.printf("Best ask:    %s%n", r.bestAsk());
        System.out.printf("Elapsed:     %.1f ms%n", r.elapsedNanos() / 1_000_000.0);
    }
}
