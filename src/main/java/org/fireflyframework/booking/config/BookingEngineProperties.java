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

import org.fireflyframework.booking.core.DocumentType;
import org.fireflyframework.booking.invoke.CallPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the booking engine.
 *
 * <p>
 * Example configuration:
 * <pre>
 * firefly.booking.max-retry-selections=3
 * firefly.booking.catalog.base-url=https://catalog.example.com
 * firefly.booking.catalog.timeout=PT10S
 * firefly.booking.verifier.max-attempts=3
 * firefly.booking.verifier.initial-backoff=PT0.5S
 * firefly.booking.documents.user-required=ID_PROOF,PARCEL_PHOTO
 * firefly.booking.security.authorized-users=alice,bob
 * firefly.booking.audit.file-enabled=true
 * firefly.booking.persistence.provider=redis
 * firefly.booking.persistence.redis.host=localhost
 * </pre>
 * An empty {@code base-url} selects the simulated collaborator for that call.
 */
@ConfigurationProperties(prefix = "firefly.booking")
public class BookingEngineProperties {

    /**
     * How many times a request may enter RETRY_SELECTION before it is failed.
     */
    private int maxRetrySelections = 3;

    @NestedConfigurationProperty
    private CallProperties catalog = new CallProperties("/candidates/search", Duration.ofSeconds(10));

    @NestedConfigurationProperty
    private CallProperties verifier = new CallProperties("/availability", Duration.ofSeconds(30));

    @NestedConfigurationProperty
    private DocumentProperties documents = new DocumentProperties();

    @NestedConfigurationProperty
    private RankingProperties ranking = new RankingProperties();

    @NestedConfigurationProperty
    private SecurityProperties security = new SecurityProperties();

    @NestedConfigurationProperty
    private AuditProperties audit = new AuditProperties();

    @NestedConfigurationProperty
    private PersistenceProperties persistence = new PersistenceProperties();

    public int getMaxRetrySelections() {
        return maxRetrySelections;
    }

    public void setMaxRetrySelections(int maxRetrySelections) {
        this.maxRetrySelections = maxRetrySelections;
    }

    public CallProperties getCatalog() {
        return catalog;
    }

    public void setCatalog(CallProperties catalog) {
        this.catalog = catalog;
    }

    public CallProperties getVerifier() {
        return verifier;
    }

    public void setVerifier(CallProperties verifier) {
        this.verifier = verifier;
    }

    public DocumentProperties getDocuments() {
        return documents;
    }

    public void setDocuments(DocumentProperties documents) {
        this.documents = documents;
    }

    public RankingProperties getRanking() {
        return ranking;
    }

    public void setRanking(RankingProperties ranking) {
        this.ranking = ranking;
    }

    public SecurityProperties getSecurity() {
        return security;
    }

    public void setSecurity(SecurityProperties security) {
        this.security = security;
    }

    public AuditProperties getAudit() {
        return audit;
    }

    public void setAudit(AuditProperties audit) {
        this.audit = audit;
    }

    public PersistenceProperties getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceProperties persistence) {
        this.persistence = persistence;
    }

    /**
     * Endpoint and retry budget of one collaborator.
     */
    public static class CallProperties {
        private String baseUrl = "";
        private String path;
        private Duration timeout;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private double jitterFactor = 0.0;

        public CallProperties() {
            this("/", Duration.ofSeconds(10));
        }

        public CallProperties(String path, Duration timeout) {
            this.path = path;
            this.timeout = timeout;
        }

        public CallPolicy toPolicy() {
            return new CallPolicy(timeout, maxAttempts, initialBackoff, maxBackoff, multiplier, jitterFactor);
        }

        public boolean isRemote() {
            return baseUrl != null && !baseUrl.isBlank();
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    /**
     * Required documents and the retry budget of the document store.
     */
    public static class DocumentProperties {
        private List<DocumentType> userRequired = new ArrayList<>(List.of(DocumentType.ID_PROOF, DocumentType.PARCEL_PHOTO));
        private List<DocumentType> providerRequired = new ArrayList<>(List.of(DocumentType.DRIVER_LICENSE, DocumentType.VEHICLE_REGISTRATION));
        private int minPayloadBytes = 16;
        private int maxPayloadBytes = 10 * 1024 * 1024;

        @NestedConfigurationProperty
        private CallProperties store = new CallProperties("/documents", Duration.ofSeconds(15));

        public List<DocumentType> getUserRequired() {
            return userRequired;
        }

        public void setUserRequired(List<DocumentType> userRequired) {
            this.userRequired = userRequired;
        }

        public List<DocumentType> getProviderRequired() {
            return providerRequired;
        }

        public void setProviderRequired(List<DocumentType> providerRequired) {
            this.providerRequired = providerRequired;
        }

        public int getMinPayloadBytes() {
            return minPayloadBytes;
        }

        public void setMinPayloadBytes(int minPayloadBytes) {
            this.minPayloadBytes = minPayloadBytes;
        }

        public int getMaxPayloadBytes() {
            return maxPayloadBytes;
        }

        public void setMaxPayloadBytes(int maxPayloadBytes) {
            this.maxPayloadBytes = maxPayloadBytes;
        }

        public CallProperties getStore() {
            return store;
        }

        public void setStore(CallProperties store) {
            this.store = store;
        }
    }

    public static class RankingProperties {
        /**
         * Price penalty per rating point below 5. 0.1 means a 4-star offer ranks as if it cost 10% more.
         */
        private double ratingWeight = 0.1;

        public double getRatingWeight() {
            return ratingWeight;
        }

        public void setRatingWeight(double ratingWeight) {
            this.ratingWeight = ratingWeight;
        }
    }

    /**
     * Input screening limits and allow-lists.
     */
    public static class SecurityProperties {
        private int maxFieldLength = 500;
        private int maxMessageLength = 10000;
        private List<String> dangerousPatterns = new ArrayList<>();
        private List<String> safeDomains = new ArrayList<>(List.of(
                "google.com", "maps.google.com", "goo.gl", "maps.app.goo.gl", "openstreetmap.org"));
        /**
         * Users allowed to create requests. Empty allows everyone.
         */
        private List<String> authorizedUsers = new ArrayList<>();

        public int getMaxFieldLength() {
            return maxFieldLength;
        }

        public void setMaxFieldLength(int maxFieldLength) {
            this.maxFieldLength = maxFieldLength;
        }

        public int getMaxMessageLength() {
            return maxMessageLength;
        }

        public void setMaxMessageLength(int maxMessageLength) {
            this.maxMessageLength = maxMessageLength;
        }

        public List<String> getDangerousPatterns() {
            return dangerousPatterns;
        }

        public void setDangerousPatterns(List<String> dangerousPatterns) {
            this.dangerousPatterns = dangerousPatterns;
        }

        public List<String> getSafeDomains() {
            return safeDomains;
        }

        public void setSafeDomains(List<String> safeDomains) {
            this.safeDomains = safeDomains;
        }

        public List<String> getAuthorizedUsers() {
            return authorizedUsers;
        }

        public void setAuthorizedUsers(List<String> authorizedUsers) {
            this.authorizedUsers = authorizedUsers;
        }
    }

    public static class AuditProperties {
        private boolean fileEnabled = false;
        private String filePath = "logs/booking-audit.log";

        public boolean isFileEnabled() {
            return fileEnabled;
        }

        public void setFileEnabled(boolean fileEnabled) {
            this.fileEnabled = fileEnabled;
        }

        public String getFilePath() {
            return filePath;
        }

        public void setFilePath(String filePath) {
            this.filePath = filePath;
        }
    }

    /**
     * Snapshot persistence. {@code provider} is {@code in-memory} or {@code redis}.
     */
    public static class PersistenceProperties {
        private String provider = "in-memory";
        private Duration terminalRetention = Duration.ofDays(7);

        @NestedConfigurationProperty
        private RedisProperties redis = new RedisProperties();

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public Duration getTerminalRetention() {
            return terminalRetention;
        }

        public void setTerminalRetention(Duration terminalRetention) {
            this.terminalRetention = terminalRetention;
        }

        public RedisProperties getRedis() {
            return redis;
        }

        public void setRedis(RedisProperties redis) {
            this.redis = redis;
        }
    }

    public static class RedisProperties {
        private String host = "localhost";
        private int port = 6379;
        private int database = 0;
        private String password;
        private String keyPrefix = "firefly:booking:";
        private Duration keyTtl;

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getDatabase() {
            return database;
        }

        public void setDatabase(int database) {
            this.database = database;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getKeyTtl() {
            return keyTtl;
        }

        public void setKeyTtl(Duration keyTtl) {
            this.keyTtl = keyTtl;
        }
    }
}
