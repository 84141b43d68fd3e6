package com.fleetsync.sync.service;

public enum ActionType {
    CREATE,
    UPDATE,
    DELETE
}
