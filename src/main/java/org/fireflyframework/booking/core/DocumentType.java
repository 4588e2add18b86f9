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

/**
 * Document kinds exchanged after confirmation, with the party expected to supply them.
 */
public enum DocumentType {
    ID_PROOF(DocumentParty.USER, false),
    PARCEL_PHOTO(DocumentParty.USER, true),
    INVOICE_COPY(DocumentParty.USER, false),
    DRIVER_LICENSE(DocumentParty.PROVIDER, false),
    VEHICLE_REGISTRATION(DocumentParty.PROVIDER, false),
    VEHICLE_INSURANCE(DocumentParty.PROVIDER, false);

    private final DocumentParty party;
    private final boolean imageOnly;

    DocumentType(DocumentParty party, boolean imageOnly) {
        this.party = party;
        this.imageOnly = imageOnly;
    }

    public DocumentParty party() {
        return party;
    }

    /**
     * Whether only image payloads are acceptable (otherwise PDF is accepted too).
     */
    public boolean imageOnly() {
        return imageOnly;
    }
}
