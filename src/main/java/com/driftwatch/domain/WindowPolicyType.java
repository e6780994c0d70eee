package com.driftwatch.domain;

public enum WindowPolicyType {
    ANCHORED,
    SLIDING
}
