package com.anthem.acctctl.core.account;

public enum ControlState {
    UNKNOWN,
    UNMANAGED,
    FREE,
    OWNED
}
