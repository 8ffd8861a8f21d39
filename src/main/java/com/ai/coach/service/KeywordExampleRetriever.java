package com.ai.coach.service;

import com.ai.coach.dto.NavigationDecision;
import com.ai.coach.dto.RetrievedExample;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ranks example utterances from a classpath JSON file by IDF-weighted token overlap
 * with the client's words, restricted to the decision's retrieval tag.
 */
@Service
public class KeywordExampleRetriever implements ExampleRetriever {

    private static final Logger log = LoggerFactory.getLogger(KeywordExampleRetriever.class);

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "you", "that", "this", "with", "for", "are", "was", "have", "what", "your", "just", "its"
    );

    private final ObjectMapper mapper = new ObjectMapper();
    private final String resourcePath;

    private List<Example> examples = Collections.emptyList();
    private Map<String, Double> idf = Collections.emptyMap();

    public KeywordExampleRetriever(@Value("${coach.retrieval.examples-resource:examples/coaching-examples.json}")
                                   String resourcePath) {
        this.resourcePath = resourcePath;
    }

    @PostConstruct
    void load() {
        List<Example> loaded = new ArrayList<>();
        try (InputStream in = new ClassPathResource(resourcePath).getInputStream()) {
            JsonNode root = mapper.readTree(in);
            for (JsonNode node : root) {
                String tag = node.path("tag").asText("");
                String text = node.path("text").asText("");
                if (StringUtils.isNoneBlank(tag, text)) {
                    loaded.add(new Example(tag, text, tokens(text)));
                }
            }
        } catch (IOException e) {
            log.warn("Example corpus {} could not be loaded, retrieval disabled: {}", resourcePath, e.getMessage());
        }
        index(loaded);
        log.info("Loaded {} coaching examples from {}", loaded.size(), resourcePath);
    }

    void index(List<Example> loaded) {
        Map<String, Integer> df = new HashMap<>();
        for (Example e : loaded) {
            for (String t : new HashSet<>(e.tokens)) {
                df.merge(t, 1, Integer::sum);
            }
        }
        double n = Math.max(1.0, loaded.size());
        Map<String, Double> weights = new HashMap<>();
        df.forEach((term, count) -> weights.put(term, Math.log((n + 1.0) / (count + 1.0)) + 1.0));
        this.examples = List.copyOf(loaded);
        this.idf = weights;
    }

    @Override
    public List<RetrievedExample> retrieveExamples(NavigationDecision decision, String rawText, int limit) {
        if (decision == null || StringUtils.isBlank(decision.getRetrievalTag()) || limit <= 0) {
            return Collections.emptyList();
        }
        Set<String> query = new HashSet<>(tokens(rawText));
        List<RetrievedExample> ranked = new ArrayList<>();
        for (Example e : examples) {
            if (!e.tag.equals(decision.getRetrievalTag())) {
                continue;
            }
            double score = 0.0;
            for (String t : e.tokens) {
                if (query.contains(t)) {
                    score += idf.getOrDefault(t, 1.0);
                }
            }
            ranked.add(new RetrievedExample(e.tag, e.text, score));
        }
        ranked.sort(Comparator.comparingDouble(RetrievedExample::getScore).reversed());
        return ranked.size() > limit ? new ArrayList<>(ranked.subList(0, limit)) : ranked;
    }

    static List<String> tokens(String text) {
        List<String> out = new ArrayList<>();
        if (StringUtils.isBlank(text)) {
            return out;
        }
        for (String raw : text.toLowerCase().split("[^a-z']+")) {
            String t = StringUtils.strip(raw, "'");
            if (t.length() >= 3 && !STOPWORDS.contains(t)) {
                out.add(t);
            }
        }
        return out;
    }

    static final class Example {
        final String tag;
        final String text;
        final List<String> tokens;

        Example(String tag, String text, List<String> tokens) {
            this.tag = tag;
            this.text = text;
            this.tokens = tokens;
        }
    }
}
