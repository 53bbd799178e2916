package com.schemalens.core.adapter;

import com.schemalens.core.model.Identifier;

/**
 * What the table listing says about a table before its parts are attached.
 */
public record TableHeader(Identifier id, Long rowCount, Long sizeKb, String description) {}
