package com.example.harborwatch.model;

public enum MatchStatus {
    LEGAL,
    DARK
}
