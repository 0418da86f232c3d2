package com.vpnshop.fulfillment.core;

import lombok.Value;

@Value
public class IngestResult {

    IngestOutcome outcome;
    String orderId;
    String message;

    public static IngestResult of(IngestOutcome outcome, String orderId, String message) {
        return new IngestResult(outcome, orderId, message);
    }
}
