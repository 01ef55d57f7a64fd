package com.example.vibescore.application;

import com.example.vibescore.domain.ChangeRecord;
import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.CommentFragment;
import com.example.vibescore.domain.DailyStat;
import com.example.vibescore.domain.ExtractedFragments;
import com.example.vibescore.domain.Identity;
import com.example.vibescore.domain.QuizTrack;
import com.example.vibescore.domain.ScanRequest;
import com.example.vibescore.domain.ScanResult;
import com.example.vibescore.domain.ScanTiming;
import com.example.vibescore.domain.StepTiming;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

@Service
public class ScanUseCase {
    private static final Logger log = LogManager.getLogger(ScanUseCase.class);

    private final HistoryProvider historyProvider;
    private final IdentityCensus identityCensus;
    private final FragmentExtractor fragmentExtractor;
    private final FragmentDeduplicator deduplicator;
    private final QuestionSampler questionSampler;
    private final Random random;
    private final int maxCommits;
    private final int sampleSize;
    private final int codeQuestions;
    private final int commentQuestions;

    public ScanUseCase(
            HistoryProvider historyProvider,
            IdentityCensus identityCensus,
            FragmentExtractor fragmentExtractor,
            FragmentDeduplicator deduplicator,
            QuestionSampler questionSampler,
            Random random,
            @Value("${vibescore.history.max-commits:2000}") int maxCommits,
            @Value("${vibescore.history.sample-size:300}") int sampleSize,
            @Value("${vibescore.quiz.code-questions:10}") int codeQuestions,
            @Value("${vibescore.quiz.comment-questions:10}") int commentQuestions) {
        this.historyProvider = historyProvider;
        this.identityCensus = identityCensus;
        this.fragmentExtractor = fragmentExtractor;
        this.deduplicator = deduplicator;
        this.questionSampler = questionSampler;
        this.random = random;
        this.maxCommits = Math.max(1, maxCommits);
        this.sampleSize = Math.max(1, sampleSize);
        this.codeQuestions = Math.max(QuestionSampler.MIN_QUESTIONS, codeQuestions);
        this.commentQuestions = Math.max(QuestionSampler.MIN_QUESTIONS, commentQuestions);
    }

    private static double nanosToSeconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private double recordStep(List<StepTiming> timings, String label, long startNanos) {
        double seconds = nanosToSeconds(System.nanoTime() - startNanos);
        timings.add(new StepTiming(label, seconds));
        log.info("{} took {}s", label, seconds);
        return seconds;
    }

    public List<Identity> listIdentities() {
        historyProvider.verifyRepository();
        List<String> records;
        try {
            records = historyProvider.listAuthorRecords(maxCommits);
        } catch (IOException e) {
            throw new NoHistoryException("Could not read commit authors", e);
        }
        List<Identity> identities = identityCensus.count(records);
        if (identities.isEmpty()) {
            throw new NoHistoryException("No commits found in the repository");
        }
        return identities;
    }

    public ScanResult scan(ScanRequest request) {
        List<StepTiming> timings = new ArrayList<>();
        long overallStart = System.nanoTime();

        historyProvider.verifyRepository();
        long listStart = System.nanoTime();
        List<String> changeIds = listChangeIds();
        recordStep(timings, "List changes", listStart);

        List<String> sampled = new ArrayList<>(changeIds);
        Collections.shuffle(sampled, random);
        sampled = sampled.subList(0, Math.min(sampleSize, sampled.size()));

        long extractStart = System.nanoTime();
        Map<String, LoadedChange> loaded = new HashMap<>();
        List<CodeFragment> code = new ArrayList<>();
        List<CommentFragment> comments = new ArrayList<>();
        int skipped = 0;
        for (String changeId : sampled) {
            LoadedChange change = load(changeId, loaded);
            if (change == null) {
                skipped++;
                continue;
            }
            if (change.diff().isEmpty()) {
                continue;
            }
            ExtractedFragments fragments =
                    fragmentExtractor.extract(
                            change.record(), change.diff(), request.isSelf(change.record().identityKey()));
            code.addAll(fragments.codeFragments());
            comments.addAll(fragments.commentFragments());
        }
        recordStep(timings, "Extract fragments from " + sampled.size() + " changes", extractStart);
        if (skipped > 0) {
            log.info("Skipped {} of {} changes that could not be read", skipped, sampled.size());
        }

        long dedupStart = System.nanoTime();
        code = deduplicator.deduplicate(code);
        comments = deduplicator.deduplicate(comments);
        recordStep(timings, "Deduplicate fragments", dedupStart);

        long velocityStart = System.nanoTime();
        List<DailyStat> velocity = analyzeVelocity(changeIds, request, loaded);
        recordStep(timings, "Analyze daily velocity", velocityStart);

        long sampleStart = System.nanoTime();
        List<CodeFragment> codeQs =
                questionSampler.sample(
                        QuizTrack.CODE,
                        code.stream().filter(CodeFragment::selfAuthored).toList(),
                        code.stream().filter(f -> !f.selfAuthored()).toList(),
                        codeQuestions);
        List<CommentFragment> commentQs =
                questionSampler.sample(
                        QuizTrack.COMMENT,
                        comments.stream().filter(CommentFragment::selfAuthored).toList(),
                        comments.stream().filter(f -> !f.selfAuthored()).toList(),
                        commentQuestions);
        recordStep(timings, "Sample questions", sampleStart);

        ScanResult result = new ScanResult(code, comments, velocity, codeQs, commentQs, sampled.size(), skipped);
        result.setTiming(new ScanTiming(List.copyOf(timings), nanosToSeconds(System.nanoTime() - overallStart)));
        log.info(
                "Scan finished: {} code / {} comment fragments, {} high-output days",
                code.size(),
                comments.size(),
                velocity.size());
        return result;
    }

    private List<String> listChangeIds() {
        List<String> changeIds;
        try {
            changeIds = historyProvider.listChangeIds(maxCommits);
        } catch (IOException e) {
            throw new NoHistoryException("Could not list commits", e);
        }
        if (changeIds.isEmpty()) {
            throw new NoHistoryException("No commits found in the repository");
        }
        return changeIds;
    }

    private List<DailyStat> analyzeVelocity(
            List<String> changeIds, ScanRequest request, Map<String, LoadedChange> loaded) {
        VelocityAggregator aggregator = new VelocityAggregator();
        for (String changeId : changeIds.subList(0, Math.min(sampleSize, changeIds.size()))) {
            LoadedChange change = load(changeId, loaded);
            if (change == null || !request.isSelf(change.record().identityKey())) {
                continue;
            }
            aggregator.record(change.record().timestamp(), change.diff());
        }
        return aggregator.highOutputDays();
    }

    /**
     * Loads and caches one change; returns null when it cannot be read.
     */
    private LoadedChange load(String changeId, Map<String, LoadedChange> cache) {
        if (cache.containsKey(changeId)) {
            return cache.get(changeId);
        }
        LoadedChange change;
        try {
            ChangeRecord record = historyProvider.loadChange(changeId);
            change = new LoadedChange(record, historyProvider.loadDiff(changeId));
        } catch (IOException e) {
            log.debug("Skipping change {}: {}", changeId, e.getMessage());
            change = null;
        }
        cache.put(changeId, change);
        return change;
    }

    private record LoadedChange(ChangeRecord record, String diff) {
        LoadedChange {
            diff = diff != null ? diff : "";
        }
    }
}
