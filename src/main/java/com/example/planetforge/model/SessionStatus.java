package com.example.planetforge.model;

public enum SessionStatus {
    OPEN,
    CLOSED
}
