package com.workq.process;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IpcMessageType {
    WORKER_STARTED("worker-started"),
    WORKER_SHUTDOWN("worker-shutdown"),
    WORKER_ERROR("worker-error");

    private final String wireName;

    IpcMessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static IpcMessageType fromWireName(String wireName) {
        for (IpcMessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown IPC message type: " + wireName);
    }
}
