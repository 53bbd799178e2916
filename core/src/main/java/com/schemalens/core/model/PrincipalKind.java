package com.schemalens.core.model;

public enum PrincipalKind {
    USER,
    ROLE
}
