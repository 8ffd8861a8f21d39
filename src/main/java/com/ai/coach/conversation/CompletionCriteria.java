package com.ai.coach.conversation;

import com.fasterxml.jackson.annotation.JsonAutoDetect;

import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Monotonic set of met criteria plus the text that satisfied each one.
 * There is deliberately no way to unset a criterion.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public class CompletionCriteria {

    private EnumSet<Criterion> met = EnumSet.of(Criterion.RAPPORT_ESTABLISHED);

    private Map<String, String> evidence = new LinkedHashMap<>();

    public boolean isMet(Criterion criterion) {
        return met.contains(criterion);
    }

    public boolean allMet(Collection<Criterion> criteria) {
        return met.containsAll(criteria);
    }

    /**
     * @return true when the criterion was not met before this call
     */
    boolean mark(Criterion criterion, String evidenceText) {
        boolean added = met.add(criterion);
        if (added && evidenceText != null && !evidenceText.isBlank()) {
            evidence.put(criterion.getKey(), evidenceText);
        }
        return added;
    }

    public String getEvidence(Criterion criterion) {
        return evidence.get(criterion.getKey());
    }

    public Map<String, Boolean> asMap() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        for (Criterion c : Criterion.values()) {
            out.put(c.getKey(), met.contains(c));
        }
        return out;
    }

    public Map<String, String> evidenceMap() {
        return new LinkedHashMap<>(evidence);
    }

    CompletionCriteria copy() {
        CompletionCriteria copy = new CompletionCriteria();
        copy.met = EnumSet.copyOf(met);
        copy.evidence = new LinkedHashMap<>(evidence);
        return copy;
    }
}
