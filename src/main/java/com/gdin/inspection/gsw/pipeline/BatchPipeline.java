package com.gdin.inspection.gsw.pipeline;

import lombok.Value;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, named steps that make up the commit of one batch.
 */
public class BatchPipeline<C> implements Iterable<BatchPipeline.Step<C>> {

    @Value
    public static class Step<C> {
        String name;
        BatchStep<C> fn;
    }

    private final List<Step<C>> steps = new ArrayList<>();

    public BatchPipeline<C> add(String name, BatchStep<C> fn) {
        if (steps.stream().anyMatch(s -> s.getName().equals(name))) {
            throw new IllegalArgumentException("step already registered: " + name);
        }
        steps.add(new Step<>(name, fn));
        return this;
    }

    public List<String> stepNames() {
        List<String> names = new ArrayList<>(steps.size());
        steps.forEach(s -> names.add(s.getName()));
        return names;
    }

    @Override
    public Iterator<Step<C>> iterator() {
        return steps.iterator();
    }
}
