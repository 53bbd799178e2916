package com.schemalens.core.extract;

import com.schemalens.core.adapter.Owned;
import com.schemalens.core.adapter.TableHeader;
import com.schemalens.core.adapter.Warnings;
import com.schemalens.core.model.CheckConstraint;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Identifier;
import com.schemalens.core.model.Index;
import com.schemalens.core.model.ModelIntegrityException;
import com.schemalens.core.model.PrimaryKey;
import com.schemalens.core.model.Table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Attaches columns, keys, indexes and checks to their tables. Columns are ordered by their
 * native position and renumbered from 1, since engines leave gaps after dropped columns.
 */
final class TableAssembler {
    private final Map<Identifier, List<Column>> columns = new HashMap<>();
    private final Map<Identifier, PrimaryKey> primaryKeys = new HashMap<>();
    private final Map<Identifier, List<Index>> indexes = new HashMap<>();
    private final Map<Identifier, List<ForeignKey>> foreignKeys = new HashMap<>();
    private final Map<Identifier, List<CheckConstraint>> checks = new HashMap<>();

    TableAssembler columns(List<Owned<Column>> owned) {
        owned.forEach(o -> columns.computeIfAbsent(o.owner(), k -> new ArrayList<>()).add(o.item()));
        return this;
    }

    TableAssembler primaryKeys(List<Owned<PrimaryKey>> owned) {
        owned.forEach(o -> primaryKeys.put(o.owner(), o.item()));
        return this;
    }

    TableAssembler indexes(List<Owned<Index>> owned) {
        owned.forEach(o -> indexes.computeIfAbsent(o.owner(), k -> new ArrayList<>()).add(o.item()));
        return this;
    }

    TableAssembler foreignKeys(List<Owned<ForeignKey>> owned) {
        owned.forEach(o -> foreignKeys.computeIfAbsent(o.owner(), k -> new ArrayList<>()).add(o.item()));
        return this;
    }

    TableAssembler checks(List<Owned<CheckConstraint>> owned) {
        owned.forEach(o -> checks.computeIfAbsent(o.owner(), k -> new ArrayList<>()).add(o.item()));
        return this;
    }

    List<Table> assemble(List<TableHeader> headers, Warnings warnings) {
        List<Table> tables = new ArrayList<>();
        for (TableHeader header : headers) {
            Identifier id = header.id();
            try {
                tables.add(new Table(
                        id,
                        renumber(columns.getOrDefault(id, List.of())),
                        primaryKeys.get(id),
                        sortedForeignKeys(foreignKeys.getOrDefault(id, List.of())),
                        sortedIndexes(indexes.getOrDefault(id, List.of())),
                        sortedChecks(checks.getOrDefault(id, List.of())),
                        header.rowCount(),
                        header.sizeKb(),
                        header.description()));
            } catch (ModelIntegrityException e) {
                warnings.skipped("table " + id, e);
            }
        }
        return tables;
    }

    private static List<Column> renumber(List<Column> raw) {
        List<Column> ordered = new ArrayList<>(raw);
        ordered.sort(Comparator.comparingInt(Column::ordinal));
        List<Column> result = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            result.add(ordered.get(i).withOrdinal(i + 1));
        }
        return result;
    }

    private static List<ForeignKey> sortedForeignKeys(List<ForeignKey> fks) {
        List<ForeignKey> sorted = new ArrayList<>(fks);
        sorted.sort(Comparator.comparing((ForeignKey fk) -> fk.name() == null ? "" : fk.name())
                .thenComparing(fk -> String.join(",", fk.columns())));
        return sorted;
    }

    private static List<Index> sortedIndexes(List<Index> list) {
        List<Index> sorted = new ArrayList<>(list);
        sorted.sort(Comparator.comparing(Index::name));
        return sorted;
    }

    private static List<CheckConstraint> sortedChecks(List<CheckConstraint> list) {
        List<CheckConstraint> sorted = new ArrayList<>(list);
        sorted.sort(Comparator.comparing((CheckConstraint c) -> c.name() == null ? "" : c.name())
                .thenComparing(CheckConstraint::expression));
        return sorted;
    }
}
