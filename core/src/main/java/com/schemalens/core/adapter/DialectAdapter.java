package com.schemalens.core.adapter;

import com.schemalens.core.catalog.CatalogKind;
import com.schemalens.core.catalog.RawRow;
import com.schemalens.core.model.CheckConstraint;
import com.schemalens.core.model.Column;
import com.schemalens.core.model.Engine;
import com.schemalens.core.model.ForeignKey;
import com.schemalens.core.model.Index;
import com.schemalens.core.model.PrimaryKey;
import com.schemalens.core.model.Routine;
import com.schemalens.core.model.SecurityPrincipal;
import com.schemalens.core.model.Sequence;
import com.schemalens.core.model.Synonym;
import com.schemalens.core.model.Trigger;
import com.schemalens.core.model.UserDefinedType;
import com.schemalens.core.model.View;

import java.util.List;

/**
 * Translates one engine's raw catalog rows into the canonical model. One implementation
 * exists per engine; it never talks to the database itself.
 *
 * <p>Each mapping method receives the rows of the matching {@link CatalogKind}. Objects
 * that violate a model invariant are skipped and reported through {@code warnings};
 * the remaining objects are still returned.
 */
public interface DialectAdapter {
    Engine engine();

    /** Whether the engine has a catalog for {@code kind} at all. */
    boolean supports(CatalogKind kind);

    /** Schema name assumed for unqualified references, null when the engine has none. */
    String defaultSchema();

    List<String> schemas(List<RawRow> rows);

    List<TableHeader> tables(List<RawRow> rows, Warnings warnings);

    List<Owned<Column>> columns(List<RawRow> rows, Warnings warnings);

    List<Owned<PrimaryKey>> primaryKeys(List<RawRow> rows, Warnings warnings);

    List<Owned<Index>> indexes(List<RawRow> rows, Warnings warnings);

    List<Owned<ForeignKey>> foreignKeys(List<RawRow> rows, Warnings warnings);

    List<Owned<CheckConstraint>> checks(List<RawRow> rows, Warnings warnings);

    List<View> views(List<RawRow> rows, Warnings warnings);

    List<Routine> routines(List<RawRow> rows, Warnings warnings);

    List<Trigger> triggers(List<RawRow> rows, Warnings warnings);

    List<UserDefinedType> types(List<RawRow> rows, Warnings warnings);

    List<Sequence> sequences(List<RawRow> rows, Warnings warnings);

    List<Synonym> synonyms(List<RawRow> rows, Warnings warnings);

    List<SecurityPrincipal> security(List<RawRow> rows, Warnings warnings);
}
