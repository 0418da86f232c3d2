package com.vpnshop.fulfillment.domain;

public enum OrderKind {
    NEW,
    RENEWAL
}
