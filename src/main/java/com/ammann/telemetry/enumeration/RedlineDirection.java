package com.ammann.telemetry.enumeration;

/**
 * Side of the redline envelope that a sample crossed.
 */
public enum RedlineDirection
{
    /** Value above the configured maximum. */
    HIGH,
    /** Value below the configured minimum. */
    LOW
}
