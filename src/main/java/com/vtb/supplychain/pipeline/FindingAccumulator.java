package com.vtb.supplychain.pipeline;

import com.vtb.supplychain.models.Finding;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Накопитель находок конвейера. Находки с одинаковым ключом
 * (пакет, версия, тип, критичность) сливаются в одну: evidence объединяется
 * с сохранением порядка, уверенность берется максимальная.
 * Удалений нет, набор только растет.
 */
public class FindingAccumulator {

    private final Map<Finding.Key, Finding> findings = new LinkedHashMap<>();

    /**
     * @return число новых ключей, появившихся после слияния
     */
    public int merge(Collection<Finding> incoming) {
        if (incoming == null) {
            return 0;
        }
        int added = 0;
        for (Finding finding : incoming) {
            if (finding == null) {
                continue;
            }
            Finding.Key key = finding.identityKey();
            Finding existing = findings.get(key);
            if (existing == null) {
                findings.put(key, finding.copy());
                added++;
            } else {
                mergeInto(existing, finding);
            }
        }
        return added;
    }

    public int size() {
        return findings.size();
    }

    public boolean isEmpty() {
        return findings.isEmpty();
    }

    /**
     * Копия текущего набора: изменения вызывающего кода сюда не попадут.
     */
    public List<Finding> snapshot() {
        List<Finding> copy = new ArrayList<>(findings.size());
        for (Finding finding : findings.values()) {
            copy.add(finding.copy());
        }
        return copy;
    }

    private void mergeInto(Finding existing, Finding incoming) {
        Set<String> evidence = new LinkedHashSet<>();
        if (existing.getEvidence() != null) {
            evidence.addAll(existing.getEvidence());
        }
        if (incoming.getEvidence() != null) {
            evidence.addAll(incoming.getEvidence());
        }
        existing.setEvidence(new ArrayList<>(evidence));
        existing.setConfidence(Math.max(existing.getConfidence(), incoming.getConfidence()));
        if (isBlank(existing.getDescription()) && !isBlank(incoming.getDescription())) {
            existing.setDescription(incoming.getDescription());
        }
        if (isBlank(existing.getRemediation()) && !isBlank(incoming.getRemediation())) {
            existing.setRemediation(incoming.getRemediation());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
