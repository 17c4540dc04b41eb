package com.fundrecon.reconciliation.wire;

import java.util.List;

/**
 * MT103 field tags read by {@link WireMessageParser}. Tags with several
 * options are tried in declaration order.
 */
enum WireTag {
    SENDER_REFERENCE(true, ":20:"),
    VALUE_DATE_CURRENCY_AMOUNT(true, ":32A:"),
    ORDERING_CUSTOMER(false, ":50K:", ":50A:", ":50F:"),
    BENEFICIARY_CUSTOMER(false, ":59:", ":59A:", ":59F:"),
    REMITTANCE_INFORMATION(false, ":70:"),
    SENDER_TO_RECEIVER_INFORMATION(false, ":72:");

    private final boolean required;
    private final List<String> markers;

    WireTag(boolean required, String... markers) {
        this.required = required;
        this.markers = List.of(markers);
    }

    boolean isRequired() {
        return required;
    }

    List<String> getMarkers() {
        return markers;
    }
}
