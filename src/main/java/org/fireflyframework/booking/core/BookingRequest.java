/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */


package org.fireflyframework.booking.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * The booking aggregate. All mutators require the request lock to be held by the caller;
 * the state machine is the only code expected to call them.
 */
public class BookingRequest {

    private final String requestId;
    private final String userId;
    private final IntentKind intentKind;
    private final BigDecimal budget;
    private final Map<String, String> constraints;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private RouteCriteria criteria;
    private BookingState state;
    private long sequence;
    private final List<String> excludedCandidateIds = new ArrayList<>();
    private List<Candidate> offeredCandidates = List.of();
    private String selectedCandidateId;
    private int retrySelections;
    private TripDetails tripDetails = TripDetails.empty();
    private Booking booking;
    private final Map<DocumentType, DocumentRecord> documents = new EnumMap<>(DocumentType.class);
    private String closureReason;
    private final Map<Long, String> appliedTriggers = new LinkedHashMap<>();
    private Instant updatedAt;

    public BookingRequest(String userId, IntentKind intentKind, RouteCriteria criteria,
                          BigDecimal budget, Map<String, String> constraints, Instant now) {
        this(UUID.randomUUID().toString(), userId, intentKind, criteria, budget, constraints, now);
    }

    private BookingRequest(String requestId, String userId, IntentKind intentKind, RouteCriteria criteria,
                           BigDecimal budget, Map<String, String> constraints, Instant now) {
        this.requestId = requestId;
        this.userId = userId;
        this.intentKind = intentKind;
        this.criteria = criteria;
        this.budget = budget;
        this.constraints = constraints == null ? Map.of() : Map.copyOf(constraints);
        this.createdAt = now;
        this.updatedAt = now;
        this.state = BookingState.SEARCHING;
    }

    /**
     * Rebuilds a request from its persisted snapshot.
     */
    public static BookingRequest fromSnapshot(BookingSnapshot s) {
        BookingRequest r = new BookingRequest(s.requestId(), s.userId(), s.intentKind(), s.criteria(),
                s.budget(), s.constraints(), s.createdAt());
        r.state = s.state();
        r.sequence = s.sequence();
        r.excludedCandidateIds.addAll(s.excludedCandidateIds());
        r.offeredCandidates = List.copyOf(s.offeredCandidates());
        r.selectedCandidateId = s.selectedCandidateId();
        r.retrySelections = s.retrySelections();
        r.tripDetails = s.tripDetails() == null ? TripDetails.empty() : s.tripDetails();
        r.booking = s.booking();
        for (DocumentRecord d : s.documents()) {
            r.documents.put(d.type(), d);
        }
        r.closureReason = s.closureReason();
        if (s.appliedTriggers() != null) {
            r.appliedTriggers.putAll(s.appliedTriggers());
        }
        r.updatedAt = s.updatedAt();
        return r;
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Request " + requestId + " mutated without holding its lock");
        }
    }

    /**
     * Moves to {@code target}, bumps the sequence and remembers which trigger produced it.
     *
     * @return the new sequence number
     */
    public long advance(BookingState target, String triggerSignature, Instant now) {
        requireLock();
        this.state = target;
        this.sequence++;
        this.appliedTriggers.put(sequence, triggerSignature);
        this.updatedAt = now;
        return sequence;
    }

    public Optional<String> triggerAppliedAt(long seq) {
        return Optional.ofNullable(appliedTriggers.get(seq));
    }

    public void updateCriteria(RouteCriteria newCriteria, Instant now) {
        requireLock();
        this.criteria = newCriteria;
        this.updatedAt = now;
    }

    public void offer(List<Candidate> candidates) {
        requireLock();
        this.offeredCandidates = List.copyOf(candidates);
    }

    public Optional<Candidate> offered(String offerId) {
        return offeredCandidates.stream().filter(c -> c.offerId().equals(offerId)).findFirst();
    }

    public void select(String offerId) {
        requireLock();
        this.selectedCandidateId = offerId;
    }

    /**
     * Adds the candidate to the excluded list. The list only ever grows.
     */
    public void exclude(String offerId) {
        requireLock();
        if (offerId != null && !excludedCandidateIds.contains(offerId)) {
            excludedCandidateIds.add(offerId);
        }
    }

    public void clearSelection() {
        requireLock();
        this.selectedCandidateId = null;
        this.offeredCandidates = List.of();
    }

    public int incrementRetrySelections() {
        requireLock();
        return ++retrySelections;
    }

    public void mergeDetails(TripDetails merged, Instant now) {
        requireLock();
        this.tripDetails = merged;
        this.updatedAt = now;
    }

    public void confirm(Booking confirmed) {
        requireLock();
        this.booking = confirmed;
    }

    public void updateBooking(Booking updated) {
        requireLock();
        this.booking = updated;
    }

    public void putDocument(DocumentRecord record, Instant now) {
        requireLock();
        documents.put(record.type(), record);
        this.updatedAt = now;
    }

    public void close(String reason) {
        requireLock();
        this.closureReason = reason;
    }

    public BookingSnapshot snapshot() {
        return withLock(() -> new BookingSnapshot(requestId, userId, intentKind, criteria, budget, constraints,
                state, sequence, offeredCandidates, selectedCandidateId, List.copyOf(excludedCandidateIds),
                retrySelections, tripDetails, tripDetails.missingRequired(), booking,
                List.copyOf(documents.values()), closureReason, new LinkedHashMap<>(appliedTriggers),
                createdAt, updatedAt));
    }

    public String getRequestId() { return requestId; }
    public String getUserId() { return userId; }
    public IntentKind getIntentKind() { return intentKind; }
    public RouteCriteria getCriteria() { return criteria; }
    public BigDecimal getBudget() { return budget; }
    public Map<String, String> getConstraints() { return constraints; }
    public BookingState getState() { return state; }
    public long getSequence() { return sequence; }
    public List<String> getExcludedCandidateIds() { return Collections.unmodifiableList(excludedCandidateIds); }
    public List<Candidate> getOfferedCandidates() { return offeredCandidates; }
    public String getSelectedCandidateId() { return selectedCandidateId; }
    public int getRetrySelections() { return retrySelections; }
    public TripDetails getTripDetails() { return tripDetails; }
    public Booking getBooking() { return booking; }
    public Collection<DocumentRecord> getDocuments() { return Collections.unmodifiableCollection(documents.values()); }
    public Optional<DocumentRecord> getDocument(DocumentType type) { return Optional.ofNullable(documents.get(type)); }
    public String getClosureReason() { return closureReason; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
