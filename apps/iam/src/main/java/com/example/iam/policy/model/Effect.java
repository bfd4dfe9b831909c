package com.example.iam.policy.model;

public enum Effect {
    ALLOW,
    DENY
}
