package com.elssolution.vuegraf.domain;

/** Last known on/off state of a device group. */
public enum PowerState { UNKNOWN, ON, OFF }
