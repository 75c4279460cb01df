package com.spending.fraud.matching;

import com.spending.fraud.concurrent.UnitResult;
import com.spending.fraud.concurrent.WorkPartitioner;
import com.spending.fraud.concurrent.WorkerPool;
import com.spending.fraud.core.model.CanonicalEntity;
import com.spending.fraud.core.model.EntityRef;
import com.spending.fraud.logging.LogContext;
import com.spending.fraud.metrics.MetricsService;
import com.spending.fraud.metrics.NoOpMetricsService;
import com.spending.fraud.normalization.BlockingKeyStrategy;
import com.spending.fraud.normalization.DefaultBlockingKeyStrategy;
import com.spending.fraud.similarity.IndelSimilarity;
import com.spending.fraud.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds pairs of entities with similar normalized names.
 *
 * <p>The larger side is split into batches that run on a {@link WorkerPool}; each probe item
 * is compared only with index-side entities sharing a blocking key or its exact name. Workers
 * read an immutable {@link BlockIndex} and return their own pair lists, which the coordinator
 * merges after the barrier. Output is sorted and independent of batch size and worker count.</p>
 *
 * <p>Identical normalized names score exactly 1.0 without fuzzy scoring. Pairs whose length
 * bound already falls below the threshold are not scored.</p>
 */
public class MatchingEngine {
    private static final Logger log = LoggerFactory.getLogger(MatchingEngine.class);

    private record Batch(int index, List<BlockIndex.Entry> items) {
    }

    private record Scored(BlockIndex.Entry entry, double score) {
    }

    private static final Comparator<Scored> BEST_FIRST = Comparator
            .comparingDouble(Scored::score).reversed()
            .thenComparing(s -> s.entry().ref());

    private final SimilarityAlgorithm similarity;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final MetricsService metrics;

    public MatchingEngine() {
        this(new IndelSimilarity(), new DefaultBlockingKeyStrategy(), new NoOpMetricsService());
    }

    public MatchingEngine(SimilarityAlgorithm similarity, BlockingKeyStrategy blockingKeyStrategy,
                          MetricsService metrics) {
        this.similarity = similarity;
        this.blockingKeyStrategy = blockingKeyStrategy;
        this.metrics = metrics;
    }

    public SimilarityAlgorithm getSimilarity() {
        return similarity;
    }

    /**
     * Self-matching: each unordered pair is emitted once, lower entity first.
     */
    public MatchingResult match(List<CanonicalEntity> entities, MatchingOptions options) {
        return match(entities, null, options);
    }

    /**
     * Matches {@code entities} against {@code reference}, or against themselves when
     * {@code reference} is null.
     */
    public MatchingResult match(List<CanonicalEntity> entities, List<CanonicalEntity> reference,
                                MatchingOptions options) {
        boolean selfMatch = reference == null;
        List<BlockIndex.Entry> left = prepare(entities);
        List<BlockIndex.Entry> right = selfMatch ? left : prepare(reference);
        int skipped = (entities.size() - left.size()) + (selfMatch ? 0 : reference.size() - right.size());
        if (skipped > 0) {
            log.debug("matching.skipped count={}", skipped);
            metrics.incrementSkippedEntities(skipped);
        }
        if (left.isEmpty() || right.isEmpty()) {
            return MatchingResult.empty(skipped);
        }

        boolean probeLeft = selfMatch || left.size() >= right.size();
        List<BlockIndex.Entry> probe = probeLeft ? left : right;
        BlockIndex index = BlockIndex.build(probeLeft ? right : left, options.getMaxBlockSize());
        if (index.oversizedBlocks() > 0) {
            log.info("matching.oversized_blocks count={} maxBlockSize={}",
                    index.oversizedBlocks(), options.getMaxBlockSize());
            metrics.incrementOversizedBlocks(index.oversizedBlocks());
        }

        List<List<BlockIndex.Entry>> partitions = WorkPartitioner.partition(probe, options.getBatchSize());
        List<Batch> batches = new ArrayList<>(partitions.size());
        for (int i = 0; i < partitions.size(); i++) {
            batches.add(new Batch(i, partitions.get(i)));
        }

        String matchId = LogContext.generateId();
        log.info("matching.start matchId={} probe={} index={} batches={} self={}",
                matchId, probe.size(), probeLeft ? right.size() : left.size(), batches.size(), selfMatch);

        WorkerPool pool = new WorkerPool("matching", options.getMaxWorkers());
        List<UnitResult<List<CandidatePair>>> results = pool.run(batches, batch -> {
            try (LogContext ignored = LogContext.forBatch(matchId, batch.index())) {
                return scoreBatch(batch, index, options, selfMatch, probeLeft);
            }
        });

        Map<String, CandidatePair> merged = new LinkedHashMap<>();
        int failedBatches = 0;
        List<String> errors = new ArrayList<>();
        for (UnitResult<List<CandidatePair>> result : results) {
            metrics.recordMatchingBatch(result.duration(), !result.isSuccess());
            if (!result.isSuccess()) {
                failedBatches++;
                String message = "batch " + result.index() + ": " + result.error();
                errors.add(message);
                log.warn("matching.batch.failed matchId={} {}", matchId, message);
                continue;
            }
            for (CandidatePair pair : result.value()) {
                merged.merge(pair.first() + "|" + pair.second(), pair,
                        (a, b) -> a.score() >= b.score() ? a : b);
            }
        }

        List<CandidatePair> pairs = new ArrayList<>(merged.values());
        pairs.sort(null);
        metrics.incrementCandidatePairs(pairs.size());
        log.info("matching.finished matchId={} pairs={} skipped={} failedBatches={}",
                matchId, pairs.size(), skipped, failedBatches);
        return new MatchingResult(pairs, skipped, failedBatches, index.oversizedBlocks(), errors);
    }

    private List<BlockIndex.Entry> prepare(List<CanonicalEntity> entities) {
        List<BlockIndex.Entry> entries = new ArrayList<>(entities.size());
        for (CanonicalEntity entity : entities) {
            if (entity == null || !entity.hasNormalizedName()) {
                continue;
            }
            String name = entity.getNormalizedName();
            entries.add(new BlockIndex.Entry(entity.ref(), name, blockingKeyStrategy.generateKeys(name)));
        }
        return entries;
    }

    private List<CandidatePair> scoreBatch(Batch batch, BlockIndex index, MatchingOptions options,
                                           boolean selfMatch, boolean probeLeft) {
        List<CandidatePair> pairs = new ArrayList<>();
        for (BlockIndex.Entry item : batch.items()) {
            for (Scored scored : bestCandidates(item, index, options)) {
                EntityRef a = item.ref();
                EntityRef b = scored.entry().ref();
                if (selfMatch) {
                    pairs.add(a.compareTo(b) < 0
                            ? new CandidatePair(a, b, scored.score())
                            : new CandidatePair(b, a, scored.score()));
                } else if (probeLeft) {
                    pairs.add(new CandidatePair(a, b, scored.score()));
                } else {
                    pairs.add(new CandidatePair(b, a, scored.score()));
                }
            }
        }
        log.debug("matching.batch.done items={} pairs={}", batch.items().size(), pairs.size());
        return pairs;
    }

    private List<Scored> bestCandidates(BlockIndex.Entry item, BlockIndex index, MatchingOptions options) {
        Map<EntityRef, BlockIndex.Entry> candidates = new LinkedHashMap<>();
        for (BlockIndex.Entry exact : index.exact(item.name())) {
            candidates.put(exact.ref(), exact);
        }
        for (String key : item.keys()) {
            for (BlockIndex.Entry entry : index.bucket(key)) {
                candidates.putIfAbsent(entry.ref(), entry);
            }
        }

        double threshold = options.getThreshold();
        List<Scored> scored = new ArrayList<>();
        for (BlockIndex.Entry candidate : candidates.values()) {
            if (candidate.ref().equals(item.ref())) {
                continue;
            }
            if (candidate.name().equals(item.name())) {
                scored.add(new Scored(candidate, 1.0));
                continue;
            }
            if (similarity.upperBound(item.name().length(), candidate.name().length()) < threshold) {
                continue;
            }
            double score = similarity.compute(item.name(), candidate.name());
            if (score >= threshold) {
                scored.add(new Scored(candidate, score));
            }
        }

        scored.sort(BEST_FIRST);
        return scored.size() > options.getMaxCandidatesPerItem()
                ? scored.subList(0, options.getMaxCandidatesPerItem())
                : scored;
    }
}
