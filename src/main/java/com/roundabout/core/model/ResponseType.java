package com.roundabout.core.model;

public enum ResponseType {
    MESSAGE,
    ACTION,
    SUGGESTION
}
