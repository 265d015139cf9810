package com.musicapi.model;

/**
 * Direction of a page-to-page step.
 */
public enum TraversalDirection {
    BACKWARDS,
    FORWARDS
}
