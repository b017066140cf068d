package com.aporkolab.dlq.alerting;

public enum AlertChannel {
    LOG,
    WEBHOOK
}
