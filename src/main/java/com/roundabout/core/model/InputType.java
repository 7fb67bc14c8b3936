package com.roundabout.core.model;

public enum InputType {
    CHAT,
    EDIT,
    COMMAND
}
