package com.defipoints.platform.model;

public enum DailyAction {
    SUPPLY,
    BORROW,
    REPAY,
    WITHDRAW
}
