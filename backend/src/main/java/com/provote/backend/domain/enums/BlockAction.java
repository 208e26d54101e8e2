package com.provote.backend.domain.enums;

public enum BlockAction {
    BLOCKED,
    REACTIVATED,
    UNBLOCKED
}
