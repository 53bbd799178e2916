package com.schemalens.core.adapter;

import com.schemalens.core.model.Identifier;

/**
 * A table part (column, key, index, check) together with the table it belongs to.
 */
public record Owned<T>(Identifier owner, T item) {}
