package com.seqweb.results.report;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class AllRetrievableIds {

    private final Set<String> ids = new LinkedHashSet<>();

    public void add(String sequenceId) {
        if (sequenceId != null && !sequenceId.isBlank()) {
            ids.add(sequenceId);
        }
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public int size() {
        return ids.size();
    }

    public List<String> asList() {
        return List.copyOf(ids);
    }
}
