package com.sweetpick.monitoring.alerting;

/** Identity of an active alert: at most one is active per key. */
public record AlertKey(String ruleName, String metric) {}
