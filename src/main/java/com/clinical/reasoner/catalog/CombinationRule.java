package com.clinical.reasoner.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An intentional combination of drugs that is not reported as duplicate therapy
 */
public final class CombinationRule {

    private final String id;
    private final SortedSet<String> members;
    private final String reason;

    public CombinationRule(String id, Collection<String> members, String reason) {
        this.id = id;
        this.members = Collections.unmodifiableSortedSet(new TreeSet<>(members));
        this.reason = reason != null ? reason : "";
    }

    /**
     * @return true when every drug is a member of this combination
     */
    public boolean covers(Collection<String> drugs) {
        return members.containsAll(drugs);
    }

    public String getId() {
        return id;
    }

    public SortedSet<String> getMembers() {
        return members;
    }

    public String getReason() {
        return reason;
    }
}
