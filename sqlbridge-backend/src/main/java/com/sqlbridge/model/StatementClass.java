package com.sqlbridge.model;

public enum StatementClass {
    READ,
    WRITE
}
