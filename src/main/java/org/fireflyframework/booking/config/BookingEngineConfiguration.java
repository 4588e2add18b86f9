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


package org.fireflyframework.booking.config;

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.booking.audit.AuditLogger;
import org.fireflyframework.booking.audit.AuditSink;
import org.fireflyframework.booking.audit.InMemoryAuditSink;
import org.fireflyframework.booking.audit.JsonLinesAuditSink;
import org.fireflyframework.booking.catalog.CandidateCatalog;
import org.fireflyframework.booking.catalog.CandidateCatalogClient;
import org.fireflyframework.booking.catalog.HttpCandidateCatalog;
import org.fireflyframework.booking.catalog.SimulatedCandidateCatalog;
import org.fireflyframework.booking.details.DetailCollector;
import org.fireflyframework.booking.details.TripFieldValidator;
import org.fireflyframework.booking.documents.DocumentGate;
import org.fireflyframework.booking.documents.DocumentStore;
import org.fireflyframework.booking.documents.InMemoryDocumentStore;
import org.fireflyframework.booking.engine.BookingEngine;
import org.fireflyframework.booking.engine.BookingStateMachine;
import org.fireflyframework.booking.invoke.ExternalCallInvoker;
import org.fireflyframework.booking.notification.LoggingOutboundTransport;
import org.fireflyframework.booking.notification.NotificationDispatcher;
import org.fireflyframework.booking.notification.OutboundTransport;
import org.fireflyframework.booking.observability.BookingEngineHealthIndicator;
import org.fireflyframework.booking.observability.BookingEvents;
import org.fireflyframework.booking.observability.BookingLoggerEvents;
import org.fireflyframework.booking.observability.CompositeBookingEvents;
import org.fireflyframework.booking.observability.MicrometerBookingEvents;
import org.fireflyframework.booking.persistence.BookingPersistenceProvider;
import org.fireflyframework.booking.persistence.impl.InMemoryBookingPersistenceProvider;
import org.fireflyframework.booking.security.SecurityGate;
import org.fireflyframework.booking.security.SensitiveDataMasker;
import org.fireflyframework.booking.tools.BookingToolFacade;
import org.fireflyframework.booking.transport.TransportEventRouter;
import org.fireflyframework.booking.verification.AvailabilityProvider;
import org.fireflyframework.booking.verification.AvailabilityVerifier;
import org.fireflyframework.booking.verification.HttpAvailabilityProvider;
import org.fireflyframework.booking.verification.SimulatedAvailabilityProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Spring configuration that wires the booking engine.
 * Users typically activate it via {@link org.fireflyframework.booking.annotations.EnableBookingEngine}.
 * <p>
 * Collaborators (catalog, availability provider, document store, outbound transport,
 * persistence) can be replaced by declaring a bean of the same type. Without a configured
 * base URL the catalog and availability provider fall back to simulated implementations.
 */
@Configuration
@EnableConfigurationProperties(BookingEngineProperties.class)
public class BookingEngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BookingEngineConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExternalCallInvoker externalCallInvoker() {
        return new ExternalCallInvoker();
    }

    @Bean
    @ConditionalOnMissingBean
    public SensitiveDataMasker sensitiveDataMasker() {
        return new SensitiveDataMasker();
    }

    @Bean
    public SecurityGate securityGate(BookingEngineProperties properties) {
        return new SecurityGate(properties.getSecurity());
    }

    @Bean
    public DetailCollector detailCollector(SecurityGate securityGate) {
        return new DetailCollector(securityGate, new TripFieldValidator());
    }

    @Bean
    @ConditionalOnMissingBean
    public CandidateCatalog candidateCatalog(BookingEngineProperties properties, WebClient.Builder webClientBuilder) {
        BookingEngineProperties.CallProperties catalog = properties.getCatalog();
        if (catalog.isRemote()) {
            log.info("Using HTTP candidate catalog at {}{}", catalog.getBaseUrl(), catalog.getPath());
            return new HttpCandidateCatalog(webClientBuilder.clone().baseUrl(catalog.getBaseUrl()).build(), catalog.getPath());
        }
        log.info("No catalog base URL configured. Using SimulatedCandidateCatalog");
        return new SimulatedCandidateCatalog();
    }

    @Bean
    @ConditionalOnMissingBean
    public AvailabilityProvider availabilityProvider(BookingEngineProperties properties, WebClient.Builder webClientBuilder) {
        BookingEngineProperties.CallProperties verifier = properties.getVerifier();
        if (verifier.isRemote()) {
            log.info("Using HTTP availability provider at {}{}", verifier.getBaseUrl(), verifier.getPath());
            return new HttpAvailabilityProvider(webClientBuilder.clone().baseUrl(verifier.getBaseUrl()).build(), verifier.getPath());
        }
        log.info("No availability provider base URL configured. Using SimulatedAvailabilityProvider");
        return new SimulatedAvailabilityProvider();
    }

    @Bean
    public CandidateCatalogClient candidateCatalogClient(CandidateCatalog catalog,
                                                         ExternalCallInvoker invoker,
                                                         BookingEngineProperties properties) {
        return new CandidateCatalogClient(catalog, invoker, properties.getCatalog().toPolicy(),
                properties.getRanking().getRatingWeight());
    }

    @Bean
    public AvailabilityVerifier availabilityVerifier(AvailabilityProvider provider,
                                                     ExternalCallInvoker invoker,
                                                     BookingEngineProperties properties) {
        return new AvailabilityVerifier(provider, invoker, properties.getVerifier().toPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentStore documentStore(BookingEngineProperties properties) {
        return new InMemoryDocumentStore(properties.getDocuments());
    }

    @Bean
    public DocumentGate documentGate(BookingEngineProperties properties) {
        return new DocumentGate(properties.getDocuments());
    }

    @Bean
    @ConditionalOnMissingBean
    public OutboundTransport outboundTransport() {
        log.info("No custom OutboundTransport found. Using LoggingOutboundTransport - messages will only be logged");
        return new LoggingOutboundTransport();
    }

    @Bean
    public NotificationDispatcher notificationDispatcher(OutboundTransport transport) {
        return new NotificationDispatcher(transport);
    }

    @Bean
    public InMemoryAuditSink auditJournal() {
        return new InMemoryAuditSink();
    }

    @Bean
    public AuditLogger auditLogger(InMemoryAuditSink auditJournal,
                                   ObjectProvider<AuditSink> sinks,
                                   SensitiveDataMasker masker,
                                   BookingEngineProperties properties) {
        List<AuditSink> extra = new ArrayList<>();
        sinks.orderedStream().filter(s -> s != auditJournal).forEach(extra::add);
        if (properties.getAudit().isFileEnabled()) {
            Path file = Path.of(properties.getAudit().getFilePath());
            log.info("Writing booking audit entries to {}", file.toAbsolutePath());
            extra.add(new JsonLinesAuditSink(file));
        }
        return new AuditLogger(auditJournal, extra, masker);
    }

    @Bean
    public BookingLoggerEvents bookingLoggerEvents() {
        return new BookingLoggerEvents();
    }

    @Bean
    @Primary
    public BookingEvents bookingEventsComposite(ApplicationContext applicationContext,
                                                ObjectProvider<MeterRegistry> meterRegistry) {
        List<BookingEvents> sinks = new ArrayList<>();

        // every other BookingEvents bean, the logger included; never the composite itself
        Map<String, BookingEvents> allEvents = applicationContext.getBeansOfType(BookingEvents.class);
        for (Map.Entry<String, BookingEvents> entry : allEvents.entrySet()) {
            if (!"bookingEventsComposite".equals(entry.getKey())) {
                sinks.add(entry.getValue());
            }
        }

        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry != null) {
            sinks.add(new MicrometerBookingEvents(registry));
        }
        return new CompositeBookingEvents(sinks);
    }

    @Bean
    @ConditionalOnMissingBean
    public BookingPersistenceProvider bookingPersistenceProvider() {
        return new InMemoryBookingPersistenceProvider();
    }

    @Bean
    public BookingStateMachine bookingStateMachine(AuditLogger auditLogger, BookingEvents events) {
        return new BookingStateMachine(auditLogger, events);
    }

    @Bean
    public BookingEngine bookingEngine(BookingEngineProperties properties,
                                       BookingStateMachine stateMachine,
                                       CandidateCatalogClient catalogClient,
                                       DetailCollector detailCollector,
                                       SecurityGate securityGate,
                                       AvailabilityVerifier verifier,
                                       DocumentGate documentGate,
                                       DocumentStore documentStore,
                                       ExternalCallInvoker invoker,
                                       AuditLogger auditLogger,
                                       NotificationDispatcher notifications,
                                       BookingPersistenceProvider persistence,
                                       BookingEvents events) {
        log.info("Initializing booking engine with {} persistence, max {} retry selection(s)",
                persistence.getProviderType(), properties.getMaxRetrySelections());
        return new BookingEngine(properties, stateMachine, catalogClient, detailCollector, securityGate,
                verifier, documentGate, documentStore, invoker, auditLogger, notifications, persistence, events);
    }

    @Bean
    public TransportEventRouter transportEventRouter(BookingEngine engine,
                                                     NotificationDispatcher notifications,
                                                     SecurityGate securityGate) {
        return new TransportEventRouter(engine, notifications, securityGate);
    }

    @Bean
    public BookingToolFacade bookingToolFacade(BookingEngine engine) {
        return new BookingToolFacade(engine);
    }

    @Configuration
    @ConditionalOnClass(AbstractHealthIndicator.class)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "bookingEngineHealthIndicator")
        public BookingEngineHealthIndicator bookingEngineHealthIndicator(BookingPersistenceProvider persistence,
                                                                         AuditLogger auditLogger) {
            return new BookingEngineHealthIndicator(persistence, auditLogger);
        }
    }
}
