package com.ecgpda.server.completion;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Clinical follow-up for one pending stack obligation. Only {@code required}
 * drives synthesis; {@code optional} and {@code leads} document what an
 * examiner would typically also look at.
 */
public class CompletionRule {
    private final List<String> required;
    private final Set<String> optional;
    private final Set<String> leads;

    public CompletionRule(List<String> required, List<String> optional, List<String> leads) {
        this.required = List.copyOf(required);
        this.optional = Collections.unmodifiableSet(new LinkedHashSet<>(optional));
        this.leads = Collections.unmodifiableSet(new LinkedHashSet<>(leads));
    }

    public static CompletionRule requiring(String... required) {
        return new CompletionRule(List.of(required), List.of(), List.of());
    }

    public List<String> getRequired() {
        return required;
    }

    public Set<String> getOptional() {
        return optional;
    }

    public Set<String> getLeads() {
        return leads;
    }

    @Override
    public String toString() {
        return "CompletionRule{required=" + required + ", optional=" + optional + ", leads=" + leads + '}';
    }
}
