package com.smartcook.query;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.smartcook.generation.ConfigMismatchException;
import com.smartcook.generation.Generation;
import com.smartcook.index.Candidate;
import com.smartcook.text.FeatureHasher;
import com.smartcook.text.HashedVector;
import com.smartcook.text.HasherConfig;

public class QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    private final FeatureHasher hasher;
    private final RankingPolicy policy;
    private final SuggestionRanker ranker;

    public QueryEngine(FeatureHasher hasher, RankingPolicy policy) {
        this.hasher = hasher;
        this.policy = policy;
        this.ranker = new SuggestionRanker(policy);
    }

    public HasherConfig hasherConfig() {
        return hasher.config();
    }

    public List<Suggestion> suggest(Generation generation, String rawQuery) {
        return suggest(generation, rawQuery, policy.defaultTopN());
    }

    public List<Suggestion> suggest(Generation generation, String rawQuery, int topN) {
        if (!hasher.config().equals(generation.hasherConfig())) {
            throw new ConfigMismatchException("Query hasher " + hasher.config()
                    + " does not match generation hasher " + generation.hasherConfig());
        }
        ParsedQuery query = ParsedQuery.parse(rawQuery);
        if (query.isEmpty() || topN <= 0) {
            return List.of();
        }

        HashedVector hashed = hasher.vectorize(query.vectorText());
        float[] projected = generation.reducer().project(hashed);
        int poolSize = Math.max(policy.candidatePoolSize(), topN);
        List<Candidate> candidates = generation.index().query(projected, poolSize);
        List<Suggestion> suggestions = ranker.rank(candidates, generation.store(), query.phrases(), topN);

        log.debug("query phrases={} candidates={} suggestions={}", query.size(), candidates.size(), suggestions.size());
        return suggestions;
    }
}
