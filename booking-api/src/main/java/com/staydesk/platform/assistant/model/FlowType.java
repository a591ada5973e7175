package com.staydesk.platform.assistant.model;

public enum FlowType {
    NEW,
    MODIFY
}
