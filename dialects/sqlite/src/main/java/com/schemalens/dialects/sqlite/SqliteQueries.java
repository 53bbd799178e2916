package com.schemalens.dialects.sqlite;

/**
 * Catalog queries for SQLite, built on {@code sqlite_master} and the table-valued pragma
 * functions. SQLite has a single documented schema, {@code main}; internal
 * {@code sqlite_%} tables are left out.
 */
public final class SqliteQueries {
    private SqliteQueries() {}

    public static final String DESCRIBE = """
            SELECT file AS database_name,
                   sqlite_version() AS version,
                   'main' AS default_schema
            FROM pragma_database_list
            WHERE name = 'main'
            """;

    public static final String SCHEMAS = """
            SELECT 'main' AS schema_name
            """;

    public static final String TABLES = """
            SELECT 'main' AS schema_name,
                   m.name AS table_name,
                   NULL AS row_count,
                   NULL AS size_kb,
                   NULL AS description
            FROM sqlite_master m
            WHERE m.type = 'table'
              AND m.name NOT LIKE 'sqlite_%'
            ORDER BY m.name
            """;

    public static final String COLUMNS = """
            SELECT 'main' AS schema_name,
                   m.name AS table_name,
                   c.name AS column_name,
                   c.cid + 1 AS ordinal,
                   c.type AS data_type,
                   c."notnull" AS not_null,
                   c.dflt_value AS default_value,
                   c.pk AS pk_ordinal,
                   c.hidden AS hidden,
                   instr(upper(m.sql), 'AUTOINCREMENT') > 0 AS autoincrement
            FROM sqlite_master m, pragma_table_xinfo(m.name) c
            WHERE m.type = 'table'
              AND m.name NOT LIKE 'sqlite_%'
              AND c.hidden <> 1
            ORDER BY m.name, c.cid
            """;

    public static final String PRIMARY_KEYS = """
            SELECT 'main' AS schema_name,
                   m.name AS table_name,
                   NULL AS constraint_name,
                   c.name AS column_name,
                   c.pk AS key_ordinal
            FROM sqlite_master m, pragma_table_info(m.name) c
            WHERE m.type = 'table'
              AND m.name NOT LIKE 'sqlite_%'
              AND c.pk > 0
            ORDER BY m.name, c.pk
            """;

    public static final String INDEXES = """
            SELECT 'main' AS schema_name,
                   m.name AS table_name,
                   il.name AS index_name,
                   il."unique" AS is_unique,
                   il.origin = 'pk' AS is_primary,
                   ii.name AS column_name,
                   CASE WHEN ii.name IS NULL THEN '(expression)' END AS expression,
                   ii.seqno + 1 AS key_ordinal,
                   0 AS is_included,
                   'BTREE' AS method,
                   CASE WHEN il.partial = 1 THEN
                       (SELECT trim(substr(x.sql, instr(upper(x.sql), ' WHERE ') + 7))
                        FROM sqlite_master x
                        WHERE x.type = 'index' AND x.name = il.name)
                   END AS filter
            FROM sqlite_master m, pragma_index_list(m.name) il, pragma_index_info(il.name) ii
            WHERE m.type = 'table'
              AND m.name NOT LIKE 'sqlite_%'
            ORDER BY m.name, il.name, ii.seqno
            """;

    public static final String FOREIGN_KEYS = """
            SELECT 'main' AS schema_name,
                   m.name AS table_name,
                   NULL AS constraint_name,
                   fk.id AS constraint_id,
                   fk."from" AS column_name,
                   fk.seq + 1 AS key_ordinal,
                   'main' AS ref_schema,
                   fk."table" AS ref_table,
                   fk."to" AS ref_column,
                   fk.on_delete AS on_delete,
                   fk.on_update AS on_update
            FROM sqlite_master m, pragma_foreign_key_list(m.name) fk
            WHERE m.type = 'table'
              AND m.name NOT LIKE 'sqlite_%'
            ORDER BY m.name, fk.id, fk.seq
            """;

    public static final String VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   'main' AS schema_name,
                   m.name AS view_name,
                   m.sql AS definition,
                   0 AS materialized,
                   NULL AS description
            FROM sqlite_master m
            WHERE m.type = 'view'
            ORDER BY m.name
            """;

    public static final String VIEW_COLUMNS = """
            SELECT 'COLUMN' AS row_kind,
                   'main' AS schema_name,
                   m.name AS view_name,
                   c.name AS column_name,
                   c.cid + 1 AS ordinal,
                   c.type AS data_type,
                   NOT c."notnull" AS nullable
            FROM sqlite_master m, pragma_table_info(m.name) c
            WHERE m.type = 'view'
            ORDER BY m.name, c.cid
            """;

    public static final String TRIGGERS = """
            SELECT 'main' AS schema_name,
                   m.name AS trigger_name,
                   'main' AS table_schema,
                   m.tbl_name AS table_name,
                   m.sql AS definition
            FROM sqlite_master m
            WHERE m.type = 'trigger'
            ORDER BY m.name
            """;
}
