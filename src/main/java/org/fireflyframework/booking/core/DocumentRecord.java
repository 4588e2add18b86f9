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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * Upload and verification state of one required document.
 */
public record DocumentRecord(DocumentType type,
                             DocumentParty party,
                             String recordId,
                             UploadStatus uploadStatus,
                             VerificationStatus verificationStatus,
                             String notes,
                             Instant updatedAt) {

    public enum UploadStatus { NOT_UPLOADED, UPLOADED }

    public enum VerificationStatus { PENDING, VERIFIED, REJECTED }

    public static DocumentRecord required(DocumentType type, Instant now) {
        return new DocumentRecord(type, type.party(), null, UploadStatus.NOT_UPLOADED,
                VerificationStatus.PENDING, null, now);
    }

    public DocumentRecord uploaded(String newRecordId, Instant now) {
        return new DocumentRecord(type, party, newRecordId, UploadStatus.UPLOADED,
                VerificationStatus.PENDING, null, now);
    }

    public DocumentRecord verified(Instant now) {
        return new DocumentRecord(type, party, recordId, uploadStatus, VerificationStatus.VERIFIED, null, now);
    }

    public DocumentRecord rejected(String reason, Instant now) {
        return new DocumentRecord(type, party, recordId, uploadStatus, VerificationStatus.REJECTED, reason, now);
    }

    @JsonIgnore
    public boolean isVerified() {
        return verificationStatus == VerificationStatus.VERIFIED;
    }
}
