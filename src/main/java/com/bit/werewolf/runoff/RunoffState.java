package com.bit.werewolf.runoff;

public enum RunoffState {
    IDLE,
    RUNOFF_OPEN,
    RUNOFF_TALLIED,
    RESOLVED
}
