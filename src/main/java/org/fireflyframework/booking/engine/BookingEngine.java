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


package org.fireflyframework.booking.engine;

import org.fireflyframework.booking.audit.AuditEntry;
import org.fireflyframework.booking.audit.AuditEventKind;
import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.AuditSeverity;
import org.fireflyframework.booking.catalog.CandidateCatalogClient;
import org.fireflyframework.booking.config.BookingEngineProperties;
import org.fireflyframework.booking.core.Booking;
import org.fireflyframework.booking.core.BookingRequest;
import org.fireflyframework.booking.core.BookingSnapshot;
import org.fireflyframework.booking.core.BookingState;
import org.fireflyframework.booking.core.BookingStatus;
import org.fireflyframework.booking.core.Candidate;
import org.fireflyframework.booking.core.DocumentRecord;
import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.core.FieldIssue;
import org.fireflyframework.booking.core.IntentKind;
import org.fireflyframework.booking.core.RouteCriteria;
import org.fireflyframework.booking.core.TripDetails;
import org.fireflyframework.booking.core.exception.BookingException;
import org.fireflyframework.booking.core.exception.ErrorKind;
import org.fireflyframework.booking.core.exception.ExternalServiceException;
import org.fireflyframework.booking.core.exception.RequestNotFoundException;
import org.fireflyframework.booking.core.exception.SecurityViolationException;
import org.fireflyframework.booking.core.exception.ValidationException;
import org.fireflyframework.booking.details.DetailCollector;
import org.fireflyframework.booking.details.DetailSubmission;
import org.fireflyframework.booking.documents.DocumentCheck;
import org.fireflyframework.booking.documents.DocumentGate;
import org.fireflyframework.booking.documents.DocumentStore;
import org.fireflyframework.booking.intent.BookingIntent;
import org.fireflyframework.booking.invoke.CallPolicy;
import org.fireflyframework.booking.invoke.ExternalCallInvoker;
import org.fireflyframework.booking.invoke.RetryListener;
import org.fireflyframework.booking.notification.NotificationDispatcher;
import org.fireflyframework.booking.notification.StatusMessage;
import org.fireflyframework.booking.observability.BookingEvents;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.fireflyframework.booking.security.SecurityGate;
import org.fireflyframework.booking.verification.AvailabilityVerifier;
import org.fireflyframework.booking.verification.VerificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Orchestrates booking requests from intent to delivery.
 * <p>
 * Each operation validates and applies its change while holding the request lock, then
 * releases it before any collaborator call. Collaborator results are applied under a freshly
 * acquired lock and discarded as stale when the request's sequence moved on in the meantime.
 * Snapshots are persisted and notifications dispatched only after the lock is released, so
 * the audit entry of a transition always precedes its notification.
 */
public class BookingEngine {

    private static final Logger log = LoggerFactory.getLogger(BookingEngine.class);
    private static final String NO_REQUEST = "-";
    private static final DateTimeFormatter NOTE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    private final BookingEngineProperties properties;
    private final BookingStateMachine stateMachine;
    private final CandidateCatalogClient catalogClient;
    private final DetailCollector detailCollector;
    private final SecurityGate securityGate;
    private final AvailabilityVerifier verifier;
    private final DocumentGate documentGate;
    private final DocumentStore documentStore;
    private final ExternalCallInvoker invoker;
    private final AuditLogger audit;
    private final NotificationDispatcher notifications;
    private final BookingPersistenceProvider persistence;
    private final BookingEvents events;

    private final ConcurrentMap<String, BookingRequest> live = new ConcurrentHashMap<>();

    public BookingEngine(BookingEngineProperties properties,
                         BookingStateMachine stateMachine,
                         CandidateCatalogClient catalogClient,
                         DetailCollector detailCollector,
                         SecurityGate securityGate,
                         AvailabilityVerifier verifier,
                         DocumentGate documentGate,
                         DocumentStore documentStore,
                         ExternalCallInvoker invoker,
                         AuditLogger audit,
                         NotificationDispatcher notifications,
                         BookingPersistenceProvider persistence,
                         BookingEvents events) {
        this.properties = properties;
        this.stateMachine = stateMachine;
        this.catalogClient = catalogClient;
        this.detailCollector = detailCollector;
        this.securityGate = securityGate;
        this.verifier = verifier;
        this.documentGate = documentGate;
        this.documentStore = documentStore;
        this.invoker = invoker;
        this.audit = audit;
        this.notifications = notifications;
        this.persistence = persistence;
        this.events = events;
    }

    // ------------------------------------------------------------------ operations

    /**
     * Opens a request from a structured intent and runs the first catalog search.
     */
    public Mono<EngineResult> create(String userId, BookingIntent intent) {
        return Mono.defer(() -> {
            if (!securityGate.isAuthorized(userId)) {
                audit.record(NO_REQUEST, AuditEventKind.UNAUTHORIZED_ACCESS, AuditSeverity.HIGH,
                        Map.of("user_id", String.valueOf(userId)));
                events.onSecurityViolation(NO_REQUEST, "user", "unauthorized access");
                return Mono.error(new SecurityViolationException("user", "unauthorized access"));
            }
            if (intent == null) {
                return Mono.error(rejectedInput(NO_REQUEST, new ValidationException("intent", "intent is required"), null));
            }
            IntentKind kind;
            RouteCriteria criteria;
            Map<String, String> constraints = new LinkedHashMap<>();
            try {
                kind = intent.kind();
                criteria = intent.toCriteria();
                for (Map.Entry<String, String> e : intent.freeTextFields().entrySet()) {
                    constraints.put(e.getKey(), securityGate.screenMessage(e.getKey(), e.getValue()));
                }
            } catch (SecurityViolationException e) {
                return Mono.error(rejectedInput(NO_REQUEST, e, intent.freeTextFields().get(e.getField())));
            } catch (ValidationException e) {
                return Mono.error(rejectedInput(NO_REQUEST, e, null));
            }

            BookingRequest request = new BookingRequest(userId, kind, criteria, intent.budget(), constraints, Instant.now());
            live.put(request.getRequestId(), request);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("user_id", userId);
            payload.put("intent_kind", kind.name());
            payload.put("origin", criteria.origin());
            payload.put("destination", criteria.destination());
            payload.put("earliest", criteria.earliest());
            payload.put("latest", criteria.latest());
            payload.put("party_count", criteria.partyCount());
            audit.record(request.getRequestId(), AuditEventKind.REQUEST_CREATED, AuditSeverity.INFO, payload);
            events.onRequestCreated(request.getRequestId(), userId);

            return persist(request.snapshot()).then(runSearch(request, 0L));
        });
    }

    /**
     * Searches again, optionally with relaxed criteria. Allowed while searching or retrying
     * a selection.
     */
    public Mono<EngineResult> searchAgain(String requestId, RouteCriteria relaxedCriteria) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            BookingState state = request.getState();
            if (state != BookingState.SEARCHING && state != BookingState.RETRY_SELECTION) {
                throw stateMachine.reject(request, "SEARCH_AGAIN");
            }
            if (relaxedCriteria != null) {
                try {
                    CandidateCatalogClient.validateCriteria(relaxedCriteria);
                } catch (ValidationException e) {
                    throw rejectedInput(requestId, e, null);
                }
                request.updateCriteria(relaxedCriteria, Instant.now());
                audit.record(requestId, AuditEventKind.CRITERIA_UPDATED, AuditSeverity.INFO, Map.of(
                        "origin", relaxedCriteria.origin(),
                        "destination", relaxedCriteria.destination(),
                        "earliest", relaxedCriteria.earliest(),
                        "latest", relaxedCriteria.latest()));
            }
            return request.getSequence();
        })).flatMap(sequence -> runSearch(request, sequence)));
    }

    /**
     * Selects an offered candidate. Details accepted before a retry cycle are kept, so when
     * they are already complete the request moves straight on to availability verification.
     */
    public Mono<EngineResult> selectCandidate(String requestId, String offerId, Long observedSequence) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (stateMachine.isReplay(request, TriggerKind.CANDIDATE_SELECTED, offerId, observedSequence)) {
                return new DetailsStep(replayed(request), null);
            }
            if (!BookingTransitions.isAllowed(request.getState(), TriggerKind.CANDIDATE_SELECTED)) {
                throw stateMachine.reject(request, TriggerKind.CANDIDATE_SELECTED.name());
            }
            Candidate candidate = offerId == null || request.getExcludedCandidateIds().contains(offerId)
                    ? null : request.offered(offerId).orElse(null);
            if (candidate == null) {
                throw rejectedInput(requestId,
                        new ValidationException("selection", "option " + offerId + " is not among the offered candidates"), null);
            }
            request.select(offerId);
            stateMachine.apply(request, TriggerKind.CANDIDATE_SELECTED, offerId, Map.of("offer_id", offerId));
            if (!request.getTripDetails().isComplete()) {
                return new DetailsStep(step(request, EventOutcome.APPLIED, List.of(),
                        s -> List.of(notifications.transitioned(s))), null);
            }
            StatusMessage selected = notifications.transitioned(request.snapshot());
            stateMachine.apply(request, TriggerKind.DETAILS_COMPLETED, null,
                    Map.of("offer_id", offerId, "fields", request.getTripDetails().asMap().size()));
            Step step = step(request, EventOutcome.APPLIED, List.of(), s -> List.of(selected, notifications.transitioned(s)));
            return new DetailsStep(step, new PendingVerification(candidate, request.getTripDetails(),
                    request.getCriteria(), request.getSequence()));
        })).flatMap(detailsStep -> publishThenVerify(request, detailsStep)));
    }

    /**
     * Merges trip details. When the last required field arrives the request moves to
     * VERIFYING_AVAILABILITY and the returned Mono completes only once the provider has answered
     * and the answer has been applied (including any re-search after a rejection).
     */
    public Mono<EngineResult> submitDetails(String requestId, Map<String, String> fields, Long observedSequence) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (stateMachine.isReplay(request, TriggerKind.DETAILS_COMPLETED, null, observedSequence)) {
                return new DetailsStep(replayed(request), null);
            }
            if (request.getState() != BookingState.COLLECTING_DETAILS) {
                throw stateMachine.reject(request, "SUBMIT_DETAILS");
            }
            DetailSubmission submission = detailCollector.submit(request.getTripDetails(), fields);
            request.mergeDetails(submission.details(), Instant.now());
            auditSubmission(request, submission);

            if (!submission.isComplete()) {
                EventOutcome outcome = submission.accepted().isEmpty() ? EventOutcome.NO_CHANGE : EventOutcome.UPDATED;
                return new DetailsStep(step(request, outcome, submission.issues(), s -> List.of(submission.hasIssues()
                        ? notifications.inputRejected(s, submission.issues())
                        : notifications.detailsNeeded(s))), null);
            }
            Candidate candidate = request.offered(request.getSelectedCandidateId()).orElse(null);
            if (candidate == null) {
                return new DetailsStep(fail(request, "selected candidate " + request.getSelectedCandidateId() + " is no longer on offer", null), null);
            }
            stateMachine.apply(request, TriggerKind.DETAILS_COMPLETED, null,
                    Map.of("offer_id", candidate.offerId(), "fields", request.getTripDetails().asMap().size()));
            Step step = step(request, EventOutcome.APPLIED, submission.issues(), s -> {
                List<StatusMessage> messages = new ArrayList<>();
                if (submission.hasIssues()) {
                    messages.add(notifications.inputRejected(s, submission.issues()));
                }
                messages.add(notifications.transitioned(s));
                return messages;
            });
            return new DetailsStep(step, new PendingVerification(candidate, request.getTripDetails(),
                    request.getCriteria(), request.getSequence()));
        })).flatMap(detailsStep -> publishThenVerify(request, detailsStep)));
    }

    /**
     * Issues the consignment note and opens the required document records.
     */
    public Mono<EngineResult> requestDocuments(String requestId, Long observedSequence) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (stateMachine.isReplay(request, TriggerKind.DOCUMENTS_REQUESTED, null, observedSequence)) {
                return replayed(request);
            }
            if (!BookingTransitions.isAllowed(request.getState(), TriggerKind.DOCUMENTS_REQUESTED)) {
                throw stateMachine.reject(request, TriggerKind.DOCUMENTS_REQUESTED.name());
            }
            Instant now = Instant.now();
            Booking booking = request.getBooking();
            String note = consignmentNote(request, booking);
            request.updateBooking(booking.withConsignmentNote(note).withStatus(BookingStatus.DOCUMENTS_PENDING));
            List<DocumentRecord> records = documentGate.openRecords(now);
            records.forEach(r -> request.putDocument(r, now));
            stateMachine.apply(request, TriggerKind.DOCUMENTS_REQUESTED, null, Map.of(
                    "consignment_note", note,
                    "documents", records.stream().map(r -> r.type().name()).collect(Collectors.joining(","))));
            return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
        })).flatMap(this::publish));
    }

    /**
     * Uploads one required document and applies the store's verdict. The transition to
     * DOCUMENTS_VERIFIED fires with the last verified record.
     */
    public Mono<EngineResult> uploadDocument(String requestId, DocumentType type, byte[] payload) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (request.getState() != BookingState.DOCUMENTS_PENDING) {
                throw stateMachine.reject(request, "UPLOAD_DOCUMENT");
            }
            if (type == null || !documentGate.isRequired(type)) {
                throw rejectedInput(requestId, new ValidationException("document_type", type + " is not required for this booking"), null);
            }
            if (request.getDocument(type).map(DocumentRecord::isVerified).orElse(false)) {
                throw rejectedInput(requestId, new ValidationException("document_type", type + " is already verified"), null);
            }
            if (payload == null || payload.length == 0) {
                throw rejectedInput(requestId, new ValidationException("payload", "document payload is empty"), null);
            }
            return request.getSequence();
        })).flatMap(sequence -> {
            CallPolicy policy = properties.getDocuments().getStore().toPolicy();
            Mono<DocumentResult> call = invoker.invoke("documents.upload", policy,
                            () -> documentStore.upload(requestId, type, payload), retryAudit(request, "documents.upload"))
                    .flatMap(recordId -> invoker.invoke("documents.verify", policy,
                                    () -> documentStore.verify(recordId), retryAudit(request, "documents.verify"))
                            .map(check -> new DocumentResult(recordId, check)));
            return timed(request, "documents", call)
                    .map(result -> request.<Step>withLock(() -> applyDocument(request, sequence, type, result)))
                    .onErrorResume(ExternalServiceException.class, e -> Mono.fromCallable(() ->
                            request.withLock(() -> degraded(request, e.getOperation(), e))))
                    .flatMap(this::publish);
        }));
    }

    public Mono<EngineResult> startTransit(String requestId, Long observedSequence) {
        return advanceBooking(requestId, TriggerKind.TRANSIT_STARTED, BookingStatus.IN_TRANSIT, observedSequence);
    }

    public Mono<EngineResult> confirmDelivery(String requestId, Long observedSequence) {
        return advanceBooking(requestId, TriggerKind.DELIVERY_CONFIRMED, BookingStatus.DELIVERED, observedSequence);
    }

    /**
     * Cancels from any non-terminal state. Results of collaborator calls still in flight are
     * discarded when they arrive.
     */
    public Mono<EngineResult> cancel(String requestId, String reason, Long observedSequence) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (stateMachine.isPriorityReplay(request, TriggerKind.USER_CANCELLED, null, observedSequence)) {
                return replayed(request);
            }
            if (request.getState().isTerminal()) {
                throw stateMachine.reject(request, TriggerKind.USER_CANCELLED.name());
            }
            String screened;
            try {
                screened = reason == null || reason.isBlank() ? "cancelled by user" : securityGate.screenMessage("reason", reason);
            } catch (SecurityViolationException | ValidationException e) {
                throw rejectedInput(requestId, e, reason);
            }
            request.close(screened);
            if (request.getBooking() != null) {
                request.updateBooking(request.getBooking().withStatus(BookingStatus.CANCELLED));
            }
            stateMachine.apply(request, TriggerKind.USER_CANCELLED, null, Map.of("reason", screened));
            return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
        })).flatMap(this::publish));
    }

    public Mono<BookingSnapshot> status(String requestId) {
        return load(requestId).map(BookingRequest::snapshot);
    }

    /**
     * The user's requests, newest first.
     */
    public Flux<BookingSnapshot> history(String userId, int limit) {
        return persistence.findByUser(userId).take(Math.max(0, limit));
    }

    public Mono<List<AuditEntry>> auditTrail(String requestId) {
        return Mono.fromSupplier(() -> audit.entriesFor(requestId));
    }

    /**
     * Loads every in-flight request from persistence into memory.
     *
     * @return number of requests rehydrated
     */
    public Mono<Long> recoverInFlight() {
        return persistence.findInFlight()
                .filter(s -> !live.containsKey(s.requestId()))
                .doOnNext(s -> live.putIfAbsent(s.requestId(), BookingRequest.fromSnapshot(s)))
                .count()
                .doOnNext(count -> log.info("Recovered {} in-flight booking request(s)", count));
    }

    /**
     * Drops terminal requests older than the configured retention from memory and persistence.
     */
    public Mono<Long> cleanupTerminal() {
        Duration retention = properties.getPersistence().getTerminalRetention();
        Instant cutoff = Instant.now().minus(retention);
        return Mono.fromRunnable(() -> live.values().removeIf(r -> r.withLock(() ->
                        r.getState().isTerminal() && r.getUpdatedAt().isBefore(cutoff))))
                .then(persistence.cleanupTerminal(retention));
    }

    // ------------------------------------------------------------------ collaborator flows

    private Mono<EngineResult> runSearch(BookingRequest request, long expectedSequence) {
        return Mono.defer(() -> {
            SearchInput input = request.withLock(() -> new SearchInput(request.getCriteria(), request.getBudget(),
                    List.copyOf(request.getExcludedCandidateIds())));
            Mono<List<Candidate>> search = catalogClient.search(request.getRequestId(), input.criteria(), input.budget(),
                    input.excluded(), retryAudit(request, CandidateCatalogClient.OPERATION));
            return timed(request, CandidateCatalogClient.OPERATION, search)
                    .map(candidates -> request.withLock(() -> applySearchResults(request, expectedSequence, candidates)))
                    .onErrorResume(e -> callFailed(request, expectedSequence, CandidateCatalogClient.OPERATION, e))
                    .flatMap(this::publish);
        });
    }

    private Step applySearchResults(BookingRequest request, long expectedSequence, List<Candidate> candidates) {
        BookingState state = request.getState();
        if (request.getSequence() != expectedSequence
                || (state != BookingState.SEARCHING && state != BookingState.RETRY_SELECTION)) {
            return stale(request, "catalog results", Map.of("observed_sequence", expectedSequence));
        }
        if (!candidates.isEmpty()) {
            request.offer(candidates);
            stateMachine.apply(request, TriggerKind.SEARCH_RESULTS, null, Map.of(
                    "candidates", candidates.stream().map(Candidate::offerId).collect(Collectors.joining(","))));
            return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
        }
        if (state == BookingState.SEARCHING) {
            audit.record(request.getRequestId(), AuditEventKind.SEARCH_EMPTY, AuditSeverity.INFO, Map.of(
                    "origin", request.getCriteria().origin(),
                    "destination", request.getCriteria().destination()));
            return step(request, EventOutcome.NO_CHANGE, List.of(), s -> List.of(notifications.noResults(s)));
        }
        request.close("no alternatives available");
        stateMachine.apply(request, TriggerKind.SEARCH_EXHAUSTED, null,
                Map.of("excluded", String.join(",", request.getExcludedCandidateIds())));
        return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
    }

    private Mono<EngineResult> runVerification(BookingRequest request, PendingVerification pending) {
        Mono<VerificationOutcome> verification = verifier.verify(request.getRequestId(), pending.candidate(),
                pending.details(), pending.criteria(), retryAudit(request, AvailabilityVerifier.OPERATION));
        return timed(request, AvailabilityVerifier.OPERATION, verification)
                .map(outcome -> request.withLock(() -> applyVerification(request, pending, outcome)))
                .onErrorResume(e -> Mono.fromCallable(() -> request.withLock(() -> verificationFailed(request, pending, e))))
                .flatMap(verificationStep -> publish(verificationStep.step())
                        .flatMap(result -> verificationStep.searchSequence() == null
                                ? Mono.just(result)
                                : runSearch(request, verificationStep.searchSequence())));
    }

    private Mono<EngineResult> publishThenVerify(BookingRequest request, DetailsStep detailsStep) {
        Mono<EngineResult> published = publish(detailsStep.step());
        if (detailsStep.verification() == null) {
            return published;
        }
        return published.then(Mono.defer(() -> runVerification(request, detailsStep.verification())));
    }

    private VerificationStep applyVerification(BookingRequest request, PendingVerification pending, VerificationOutcome outcome) {
        if (request.getSequence() != pending.sequence() || request.getState() != BookingState.VERIFYING_AVAILABILITY) {
            return new VerificationStep(stale(request, "availability result for " + pending.candidate().offerId(),
                    Map.of("observed_sequence", pending.sequence(), "outcome", outcome.getClass().getSimpleName())), null);
        }
        String offerId = pending.candidate().offerId();
        if (outcome instanceof VerificationOutcome.Confirmed confirmed) {
            request.confirm(new Booking(confirmed.bookingReference(), offerId, pending.details(),
                    pending.candidate().price(), null, BookingStatus.CONFIRMED, Instant.now()));
            stateMachine.apply(request, TriggerKind.AVAILABILITY_CONFIRMED, confirmed.bookingReference(),
                    Map.of("offer_id", offerId, "booking_reference", confirmed.bookingReference()));
            return new VerificationStep(step(request, EventOutcome.APPLIED, List.of(),
                    s -> List.of(notifications.transitioned(s))), null);
        }
        VerificationOutcome.Rejected rejected = (VerificationOutcome.Rejected) outcome;
        request.exclude(offerId);
        request.clearSelection();
        stateMachine.apply(request, TriggerKind.AVAILABILITY_REJECTED, offerId,
                Map.of("offer_id", offerId, "reason", rejected.reason()));
        return enterRetrySelection(request, List.of());
    }

    private VerificationStep verificationFailed(BookingRequest request, PendingVerification pending, Throwable error) {
        if (request.getSequence() != pending.sequence() || request.getState() != BookingState.VERIFYING_AVAILABILITY) {
            return new VerificationStep(stale(request, "availability failure for " + pending.candidate().offerId(),
                    Map.of("observed_sequence", pending.sequence(), "error", String.valueOf(error.getMessage()))), null);
        }
        if (!(error instanceof ExternalServiceException external)) {
            return new VerificationStep(fail(request, "unrecoverable error during availability check", error), null);
        }
        recordDegraded(request, AvailabilityVerifier.OPERATION, external);
        request.clearSelection();
        stateMachine.apply(request, TriggerKind.VERIFICATION_UNAVAILABLE, null,
                Map.of("offer_id", pending.candidate().offerId(), "attempts", external.getAttempts()));
        StatusMessage degradedNotice = notifications.degraded(request.snapshot(), AvailabilityVerifier.OPERATION);
        return enterRetrySelection(request, List.of(degradedNotice));
    }

    /**
     * Called right after a transition into RETRY_SELECTION. Fails the request once the retry
     * ceiling is exceeded, otherwise hands back the sequence the follow-up search must see.
     */
    private VerificationStep enterRetrySelection(BookingRequest request, List<StatusMessage> leading) {
        List<StatusMessage> messages = new ArrayList<>(leading);
        messages.add(notifications.transitioned(request.snapshot()));
        int cycles = request.incrementRetrySelections();
        if (cycles > properties.getMaxRetrySelections()) {
            request.close("retry limit reached");
            stateMachine.apply(request, TriggerKind.RETRY_LIMIT_REACHED, null, Map.of("retry_selections", cycles));
            return new VerificationStep(step(request, EventOutcome.APPLIED, List.of(), s -> {
                messages.add(notifications.transitioned(s));
                return messages;
            }), null);
        }
        return new VerificationStep(step(request, EventOutcome.APPLIED, List.of(), s -> messages), request.getSequence());
    }

    private Step applyDocument(BookingRequest request, long expectedSequence, DocumentType type, DocumentResult result) {
        if (request.getSequence() != expectedSequence || request.getState() != BookingState.DOCUMENTS_PENDING) {
            return stale(request, "document check for " + type,
                    Map.of("observed_sequence", expectedSequence, "record_id", result.recordId()));
        }
        Instant now = Instant.now();
        DocumentRecord current = request.getDocument(type).orElseGet(() -> DocumentRecord.required(type, now));
        DocumentRecord uploaded = current.uploaded(result.recordId(), now);
        audit.record(request.getRequestId(), AuditEventKind.DOCUMENT_UPLOADED, AuditSeverity.INFO,
                Map.of("document_type", type.name(), "record_id", result.recordId()));
        DocumentRecord checked = documentGate.apply(uploaded, result.check(), now);
        request.putDocument(checked, now);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("document_type", type.name());
        payload.put("record_id", result.recordId());
        payload.put("verified", result.check().verified());
        payload.put("reason", result.check().reason());
        audit.record(request.getRequestId(), AuditEventKind.DOCUMENT_CHECKED,
                result.check().verified() ? AuditSeverity.INFO : AuditSeverity.MEDIUM, payload);

        if (!result.check().verified()) {
            List<FieldIssue> issues = List.of(new FieldIssue(type.name(), ErrorKind.VALIDATION_ERROR, result.check().reason()));
            return step(request, EventOutcome.UPDATED, issues, s -> List.of(notifications.inputRejected(s, issues)));
        }
        if (documentGate.allVerified(request.getDocuments())) {
            request.updateBooking(request.getBooking().withStatus(BookingStatus.DOCUMENTS_VERIFIED));
            stateMachine.apply(request, TriggerKind.DOCUMENTS_VERIFIED, null, Map.of("last_document", type.name()));
            return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
        }
        return step(request, EventOutcome.UPDATED, List.of(), s -> List.of(notifications.documentAccepted(s, type)));
    }

    private Mono<EngineResult> advanceBooking(String requestId, TriggerKind trigger, BookingStatus status, Long observedSequence) {
        return load(requestId).flatMap(request -> Mono.fromCallable(() -> request.withLock(() -> {
            if (stateMachine.isReplay(request, trigger, null, observedSequence)) {
                return replayed(request);
            }
            if (!BookingTransitions.isAllowed(request.getState(), trigger)) {
                throw stateMachine.reject(request, trigger.name());
            }
            request.updateBooking(request.getBooking().withStatus(status));
            stateMachine.apply(request, trigger, null, Map.of("booking_status", status.name()));
            return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
        })).flatMap(this::publish));
    }

    private Mono<Step> callFailed(BookingRequest request, long expectedSequence, String operation, Throwable error) {
        if (error instanceof ExternalServiceException external) {
            return Mono.fromCallable(() -> request.withLock(() -> {
                if (request.getSequence() != expectedSequence) {
                    return stale(request, operation + " failure", Map.of("observed_sequence", expectedSequence));
                }
                return degraded(request, operation, external);
            }));
        }
        if (error instanceof BookingException) {
            return Mono.error(error);
        }
        return Mono.fromCallable(() -> request.withLock(() -> request.getSequence() == expectedSequence && !request.getState().isTerminal()
                ? fail(request, "unrecoverable error during " + operation, error)
                : stale(request, operation + " failure", Map.of("observed_sequence", expectedSequence))));
    }

    // ------------------------------------------------------------------ helpers

    private Mono<BookingRequest> load(String requestId) {
        return Mono.defer(() -> {
            if (requestId == null) {
                return Mono.error(new RequestNotFoundException("null"));
            }
            BookingRequest request = live.get(requestId);
            if (request != null) {
                return Mono.just(request);
            }
            return persistence.find(requestId).flatMap(found -> found
                    .map(snapshot -> {
                        log.info("Rehydrating booking request {} from {} persistence at sequence {}",
                                requestId, persistence.getProviderType(), snapshot.sequence());
                        return Mono.just(live.computeIfAbsent(requestId, id -> BookingRequest.fromSnapshot(snapshot)));
                    })
                    .orElseGet(() -> Mono.error(new RequestNotFoundException(requestId))));
        });
    }

    private Step step(BookingRequest request, EventOutcome outcome, List<FieldIssue> issues,
                      Function<BookingSnapshot, List<StatusMessage>> messages) {
        BookingSnapshot snapshot = request.snapshot();
        return new Step(snapshot, new EngineResult(snapshot, outcome, issues), messages.apply(snapshot));
    }

    private Step replayed(BookingRequest request) {
        return step(request, EventOutcome.REPLAYED, List.of(), s -> List.of());
    }

    private Step stale(BookingRequest request, String description, Map<String, ?> detail) {
        stateMachine.recordStale(request, description, detail);
        return step(request, EventOutcome.STALE_DISCARDED, List.of(), s -> List.of());
    }

    private Step degraded(BookingRequest request, String operation, ExternalServiceException error) {
        recordDegraded(request, operation, error);
        return step(request, EventOutcome.DEGRADED, List.of(), s -> List.of(notifications.degraded(s, operation)));
    }

    private void recordDegraded(BookingRequest request, String operation, ExternalServiceException error) {
        audit.record(request.getRequestId(), AuditEventKind.EXTERNAL_SERVICE_DEGRADED, AuditSeverity.MEDIUM, Map.of(
                "operation", operation,
                "attempts", error.getAttempts(),
                "error", String.valueOf(error.getMessage())));
        events.onExternalServiceDegraded(request.getRequestId(), operation, error);
    }

    private Step fail(BookingRequest request, String reason, Throwable error) {
        if (error != null) {
            log.error("Failing booking request {}: {}", request.getRequestId(), reason, error);
        }
        request.close(reason);
        stateMachine.apply(request, TriggerKind.UNRECOVERABLE_ERROR, null, Map.of(
                "reason", reason,
                "error", error == null ? "" : error.getClass().getSimpleName()));
        return step(request, EventOutcome.APPLIED, List.of(), s -> List.of(notifications.transitioned(s)));
    }

    private void auditSubmission(BookingRequest request, DetailSubmission submission) {
        String requestId = request.getRequestId();
        if (!submission.accepted().isEmpty()) {
            Map<String, Object> accepted = new LinkedHashMap<>();
            submission.accepted().forEach(f -> accepted.put(f.key(), submission.details().get(f).orElse("")));
            audit.record(requestId, AuditEventKind.DETAILS_UPDATED, AuditSeverity.INFO, accepted);
        }
        for (FieldIssue issue : submission.issues()) {
            if (issue.kind() == ErrorKind.SECURITY_VIOLATION) {
                Map<String, Object> payload = new LinkedHashMap<>();
                payload.put("field", issue.field());
                payload.put("reason", issue.message());
                payload.put("input", submission.rejectedInputs().get(issue.field()));
                audit.record(requestId, AuditEventKind.SECURITY_VIOLATION, AuditSeverity.HIGH, payload);
                events.onSecurityViolation(requestId, issue.field(), issue.message());
            } else {
                audit.record(requestId, AuditEventKind.VALIDATION_FAILED, AuditSeverity.MEDIUM,
                        Map.of("field", issue.field(), "message", issue.message()));
                events.onValidationFailed(requestId, issue.field(), issue.message());
            }
        }
    }

    /**
     * Audits rejected input and returns the exception for the caller to raise.
     */
    private BookingException rejectedInput(String requestId, BookingException error, String rawInput) {
        if (error instanceof SecurityViolationException violation) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("field", violation.getField());
            payload.put("reason", violation.getReason());
            payload.put("input", rawInput);
            audit.record(requestId, AuditEventKind.SECURITY_VIOLATION, AuditSeverity.HIGH, payload);
            events.onSecurityViolation(requestId, violation.getField(), violation.getReason());
        } else {
            String field = error instanceof ValidationException v && v.getField() != null ? v.getField() : "request";
            audit.record(requestId, AuditEventKind.VALIDATION_FAILED, AuditSeverity.MEDIUM,
                    Map.of("field", field, "message", error.getMessage()));
            events.onValidationFailed(requestId, field, error.getMessage());
        }
        return error;
    }

    private RetryListener retryAudit(BookingRequest request, String operation) {
        return (failedAttempt, error) -> {
            audit.record(request.getRequestId(), AuditEventKind.RETRY_ATTEMPT, AuditSeverity.MEDIUM, Map.of(
                    "operation", operation,
                    "failed_attempt", failedAttempt,
                    "error", error.getClass().getSimpleName()));
            events.onRetry(request.getRequestId(), operation, failedAttempt, error);
        };
    }

    private <T> Mono<T> timed(BookingRequest request, String operation, Mono<T> call) {
        return Mono.defer(() -> {
            long start = System.nanoTime();
            return call
                    .doOnSuccess(v -> events.onCallCompleted(request.getRequestId(), operation, true, elapsedMs(start)))
                    .doOnError(e -> events.onCallCompleted(request.getRequestId(), operation, false, elapsedMs(start)));
        });
    }

    private Mono<EngineResult> publish(Step step) {
        return persist(step.snapshot())
                .then(notifications.dispatch(step.messages()))
                .thenReturn(step.result());
    }

    private Mono<Void> persist(BookingSnapshot snapshot) {
        return persistence.persist(snapshot)
                .onErrorResume(e -> {
                    log.error("Failed to persist booking request {} at sequence {}", snapshot.requestId(), snapshot.sequence(), e);
                    events.onPersistenceFailed(snapshot.requestId(), e);
                    return Mono.empty();
                });
    }

    private static String consignmentNote(BookingRequest request, Booking booking) {
        String suffix = request.getRequestId().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        return "CN-" + NOTE_DATE.format(booking.confirmedAt()) + "-" + suffix;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Step(BookingSnapshot snapshot, EngineResult result, List<StatusMessage> messages) {
    }

    private record DetailsStep(Step step, PendingVerification verification) {
    }

    private record VerificationStep(Step step, Long searchSequence) {
    }

    private record PendingVerification(Candidate candidate, TripDetails details, RouteCriteria criteria, long sequence) {
    }

    private record SearchInput(RouteCriteria criteria, BigDecimal budget, List<String> excluded) {
    }

    private record DocumentResult(String recordId, DocumentCheck check) {
    }
}
