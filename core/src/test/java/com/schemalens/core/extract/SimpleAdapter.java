package com.schemalens.core.extract;

import com.schemalens.core.adapter.AbstractDialectAdapter;
import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Engine;

import java.util.EnumSet;

/**
 * Adapter over the shared row contract with the plainest possible column mapping.
 */
class SimpleAdapter extends AbstractDialectAdapter {

    SimpleAdapter() {
        super(Engine.POSTGRES, EnumSet.complementOf(EnumSet.of(CatalogKind.SYNONYMS)));
    }

    @Override
    protected Column column(RawRow row) {
        return Column.builder(required(row, "column_name"), type(row, "data_type"))
                .nullable(row.flag("nullable"))
                .defaultValue(row.text("default_value"))
                .ordinal(position(row, "ordinal"))
                .build();
    }
}
