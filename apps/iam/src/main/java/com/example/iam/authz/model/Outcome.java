package com.example.iam.authz.model;

public enum Outcome {
    ALLOW,
    DENY
}
