package com.schemalens.core.model;

public enum TypeCategory {
    ENUM,
    COMPOSITE,
    DOMAIN,
    TABLE_TYPE,
    ALIAS
}
