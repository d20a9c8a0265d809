package io.ticketforge.engine;

import io.ticketforge.client.CreateRequest;
import io.ticketforge.client.LinkResult;
import io.ticketforge.client.TrackerClient;
import io.ticketforge.model.RecordKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory tracker that hands out sequential keys and records every call.
 * Failures and side effects are injected per call.
 */
public final class RecordingTrackerClient implements TrackerClient {
    private final AtomicInteger keySeq = new AtomicInteger();
    private final List<Call> calls = new ArrayList<>();
    private final Map<String, String> summaryByKey = new HashMap<>();
    private final Map<String, Integer> inFlightByGroup = new HashMap<>();
    private final Function<String, String> groupOfSummary;
    private volatile Function<Call, RuntimeException> failures = call -> null;
    private volatile Consumer<Call> onCall = call -> {
    };
    private volatile long delayMs;
    private int maxInFlightPerGroup;
    private int inFlight;
    private int maxInFlight;

    public RecordingTrackerClient() {
        this(summary -> "");
    }

    public RecordingTrackerClient(Function<String, String> groupOfSummary) {
        this.groupOfSummary = groupOfSummary;
    }

    public RecordingTrackerClient failWhen(Function<Call, RuntimeException> failures) {
        this.failures = failures;
        return this;
    }

    public RecordingTrackerClient onCall(Consumer<Call> onCall) {
        this.onCall = onCall;
        return this;
    }

    public RecordingTrackerClient delayMs(long delayMs) {
        this.delayMs = delayMs;
        return this;
    }

    @Override
    public String create(RecordKind kind, CreateRequest request) {
        Call call = new Call("create", kind, request.summary(), request.parentKey(), request.epicKey(), null, null);
        invoke(call, groupOfSummary.apply(request.summary()));
        String key = "MIG-" + keySeq.incrementAndGet();
        synchronized (this) {
            summaryByKey.put(key, request.summary());
        }
        return key;
    }

    @Override
    public LinkResult link(String sourceKey, String targetKey, List<String> typeCandidates) {
        Call call = new Call("link", null, summaryOf(sourceKey), sourceKey, targetKey, null, null);
        invoke(call, groupOfSummary.apply(summaryOf(sourceKey)));
        return new LinkResult(typeCandidates.get(0), List.of(typeCandidates.get(0)));
    }

    @Override
    public void setField(String key, String fieldName, String value) {
        Call call = new Call("setField", null, summaryOf(key), key, null, fieldName, value);
        invoke(call, groupOfSummary.apply(summaryOf(key)));
    }

    private void invoke(Call call, String group) {
        synchronized (this) {
            calls.add(call);
            inFlight++;
            maxInFlight = Math.max(maxInFlight, inFlight);
            int groupCount = inFlightByGroup.merge(group, 1, Integer::sum);
            maxInFlightPerGroup = Math.max(maxInFlightPerGroup, groupCount);
        }
        try {
            onCall.accept(call);
            if (delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            RuntimeException failure = failures.apply(call);
            if (failure != null) {
                throw failure;
            }
        } finally {
            synchronized (this) {
                inFlight--;
                inFlightByGroup.merge(group, -1, Integer::sum);
            }
        }
    }

    private synchronized String summaryOf(String key) {
        return summaryByKey.getOrDefault(key, "");
    }

    public synchronized List<Call> calls() {
        return List.copyOf(calls);
    }

    public synchronized List<Call> calls(String operation) {
        return calls.stream().filter(c -> c.operation().equals(operation)).toList();
    }

    public synchronized int maxInFlightPerGroup() {
        return maxInFlightPerGroup;
    }

    public synchronized int maxInFlight() {
        return maxInFlight;
    }

    /**
     * {@code summary} is the created record's summary for creates and the
     * summary of the record being linked or updated otherwise.
     */
    public record Call(
            String operation,
            RecordKind kind,
            String summary,
            String key,
            String otherKey,
            String fieldName,
            String value
    ) {
    }
}
