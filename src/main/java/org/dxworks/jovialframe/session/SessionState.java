package org.dxworks.jovialframe.session;

public enum SessionState {
    IDLE,
    ANALYZING
}
