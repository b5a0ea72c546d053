package com.example.harborwatch.model;

public record Classification(String label, ColorHint colorHint) {
}
