package com.autorestake.model;

public enum AttemptOutcome {
    PENDING,
    SUCCESS,
    FAILURE
}
