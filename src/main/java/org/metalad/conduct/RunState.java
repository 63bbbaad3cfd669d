package org.metalad.conduct;

public enum RunState {
    PENDING, RUNNING, COMPLETED, FAILED
}
