package com.example.harborwatch.model;

/**
 * Rendering hint attached to a classified target for map and image overlays.
 */
public enum ColorHint {
    GREEN,
    RED
}
