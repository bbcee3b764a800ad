package com.elssolution.vuegraf.usage;

/** Why an account's cycle was skipped. Both kinds are recoverable. */
public enum FailureKind { TIMEOUT, OTHER }
