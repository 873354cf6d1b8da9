// file: bench/src/main/java/io/eventchat/bench/SynchronizerBench.java
package io.eventchat.bench;

import io.eventchat.core.ConversationKey;
import io.eventchat.core.MessageSynchronizer;
import io.eventchat.core.MessageVersion;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * In-process microbenchmark for {@link MessageSynchronizer}.
 *
 * Phases, each timed per operation:
 *   1) create:  post --messages messages from --authors Zipf-distributed authors.
 *   2) merge:   feed back remote versions; a mix of duplicates, newer versions
 *               and same-version conflicts (--conflict-ratio).
 *   3) order:   orderedMessages(--limit) repeated --order-runs times.
 *
 * Usage:
 *   java -jar bench.jar --messages 10000 --authors 50 --zipf-skew 0.99 \
 *     --conflict-ratio 0.2 --limit 50 --order-runs 200
 *
 * Output:
 *   - Summary line per phase to stderr.
 *   - CSV to stdout with per-op latency samples:
 *       phase,outcome,latency_us
 */
public final class SynchronizerBench {

    record Sample(String phase, String outcome, double latencyUs) {
    }

    public static void main(String[] args) {
        Map<String, String> cfg = parseArgs(args);

        int messages = Integer.parseInt(cfg.getOrDefault("messages", "10000"));
        int authors = Integer.parseInt(cfg.getOrDefault("authors", "50"));
        double zipfSkew = Double.parseDouble(cfg.getOrDefault("zipf-skew", "0.99"));
        double conflictRatio = Double.parseDouble(cfg.getOrDefault("conflict-ratio", "0.2"));
        int limit = Integer.parseInt(cfg.getOrDefault("limit", "50"));
        int orderRuns = Integer.parseInt(cfg.getOrDefault("order-runs", "200"));
        long seed = Long.parseLong(cfg.getOrDefault("seed", "42"));

        List<Sample> samples = run(messages, authors, zipfSkew, conflictRatio, limit, orderRuns, seed);
        summarizeAndPrint(samples);
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (a.startsWith("--")) {
                String key = a.substring(2);
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("missing value for " + a);
                }
                out.put(key, args[++i]);
            } else {
                throw new IllegalArgumentException("unexpected arg: " + a);
            }
        }
        return out;
    }

    static List<Sample> run(
            int messages,
            int authors,
            double zipfSkew,
            double conflictRatio,
            int limit,
            int orderRuns,
            long seed
    ) {
        var sync = new MessageSynchronizer(ConversationKey.event(1));
        var picker = new ZipfianAuthorPicker(authors, zipfSkew, seed);
        var rnd = new Random(seed);
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        List<Sample> samples = new ArrayList<>(messages * 2 + orderRuns);

        // 1) create
        List<MessageVersion> created = new ArrayList<>(messages);
        for (int i = 1; i <= messages; i++) {
            long author = picker.next();
            long start = System.nanoTime();
            MessageVersion v = sync.createVersion(i, author, "message " + i, base.plusMillis(i));
            samples.add(new Sample("create", "ok", micros(start)));
            created.add(v);
        }

        // 2) merge
        for (MessageVersion v : created) {
            MessageVersion remote = remoteCopy(v, rnd, conflictRatio, authors);
            long start = System.nanoTime();
            boolean accepted = sync.merge(remote).isNew();
            samples.add(new Sample("merge", accepted ? "accepted" : "ignored", micros(start)));
        }

        // 3) order
        for (int i = 0; i < orderRuns; i++) {
            long start = System.nanoTime();
            int n = sync.orderedMessages(limit).size();
            samples.add(new Sample("order", n == Math.min(limit == 0 ? messages : limit, messages) ? "ok" : "short",
                    micros(start)));
        }
        return samples;
    }

    /** Duplicate, bump or conflict with a stored version. */
    private static MessageVersion remoteCopy(MessageVersion v, Random rnd, double conflictRatio, int authors) {
        double roll = rnd.nextDouble();
        if (roll < conflictRatio) {
            long other = 1 + rnd.nextInt(authors);
            return new MessageVersion(v.messageId(), v.clock(), "edit by " + other, other, v.createdAt().plusMillis(1));
        }
        if (roll < conflictRatio + (1 - conflictRatio) / 2) {
            Map<Long, Integer> bumped = new HashMap<>(v.clock());
            bumped.merge(v.authorId(), 1, Integer::sum);
            return new MessageVersion(v.messageId(), bumped, v.content() + " (edited)", v.authorId(), v.createdAt());
        }
        return v;
    }

    private static double micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000.0;
    }

    private static void summarizeAndPrint(List<Sample> all) {
        if (all.isEmpty()) {
            System.err.println("no samples collected");
            return;
        }

        Map<String, List<Sample>> byPhase = new HashMap<>();
        for (Sample s : all) {
            byPhase.computeIfAbsent(s.phase(), k -> new ArrayList<>()).add(s);
        }
        for (String phase : List.of("create", "merge", "order")) {
            List<Sample> ps = byPhase.getOrDefault(phase, List.of());
            List<Double> latencies = new ArrayList<>(ps.size());
            Map<String, Integer> outcomes = new HashMap<>();
            for (Sample s : ps) {
                latencies.add(s.latencyUs());
                outcomes.merge(s.outcome(), 1, Integer::sum);
            }
            Collections.sort(latencies);
            System.err.printf(
                    "%s: ops=%d, outcomes=%s, p50=%.2fus, p95=%.2fus, p99=%.2fus%n",
                    phase, ps.size(), outcomes,
                    percentile(latencies, 0.50), percentile(latencies, 0.95), percentile(latencies, 0.99)
            );
        }

        // CSV to stdout.
        System.out.println("phase,outcome,latency_us");
        for (Sample s : all) {
            System.out.printf("%s,%s,%.3f%n", s.phase(), s.outcome(), s.latencyUs());
        }
    }

    static double percentile(List<Double> sorted, double q) {
        if (sorted.isEmpty()) return Double.NaN;
        double idx = q * (sorted.size() - 1);
        int lo = (int) Math.floor(idx);
        int hi = (int) Math.ceil(idx);
        if (lo == hi) return sorted.get(lo);
        double w = idx - lo;
        return sorted.get(lo) * (1 - w) + sorted.get(hi) * w;
    }
}
