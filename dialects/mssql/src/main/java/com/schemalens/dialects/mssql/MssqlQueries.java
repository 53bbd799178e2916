package com.schemalens.dialects.mssql;

/**
 * {@code sys} catalog view queries for SQL Server 2016 and later. Types come back as the
 * bare {@code sys.types} name with {@code max_length}, {@code precision} and {@code scale}
 * alongside; the adapter builds the declared form from them.
 */
public final class MssqlQueries {

    private MssqlQueries() {
    }

    public static final String DESCRIBE = """
            SELECT DB_NAME() AS database_name,
                   'SQL Server ' + CAST(SERVERPROPERTY('ProductVersion') AS NVARCHAR(128))
                       + ' ' + CAST(SERVERPROPERTY('Edition') AS NVARCHAR(128)) AS version,
                   SCHEMA_NAME() AS default_schema
            """;

    public static final String SCHEMAS = """
            SELECT s.name AS schema_name
            FROM sys.schemas s
            ORDER BY s.name
            """;

    public static final String TABLES = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   (SELECT SUM(p.rows) FROM sys.partitions p
                     WHERE p.object_id = t.object_id AND p.index_id IN (0, 1)) AS row_count,
                   (SELECT SUM(a.total_pages) * 8 FROM sys.partitions p
                      JOIN sys.allocation_units a ON a.container_id = p.partition_id
                     WHERE p.object_id = t.object_id) AS size_kb,
                   CAST(ep.value AS NVARCHAR(MAX)) AS description
            FROM sys.tables t
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            LEFT JOIN sys.extended_properties ep
                   ON ep.class = 1 AND ep.major_id = t.object_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            WHERE t.is_ms_shipped = 0
            ORDER BY s.name, t.name
            """;

    public static final String COLUMNS = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   c.name AS column_name,
                   c.column_id AS ordinal,
                   ty.name AS data_type,
                   CASE WHEN ty.is_user_defined = 1 THEN SCHEMA_NAME(ty.schema_id) END AS type_schema,
                   c.max_length AS max_length,
                   c.precision AS precision,
                   c.scale AS scale,
                   c.is_nullable AS nullable,
                   dc.definition AS default_value,
                   c.is_identity AS is_identity,
                   CAST(ic.seed_value AS BIGINT) AS identity_seed,
                   CAST(ic.increment_value AS BIGINT) AS identity_increment,
                   cc.definition AS computed_definition,
                   CAST(ep.value AS NVARCHAR(MAX)) AS description
            FROM sys.columns c
            JOIN sys.tables t ON t.object_id = c.object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            JOIN sys.types ty ON ty.user_type_id = c.user_type_id
            LEFT JOIN sys.default_constraints dc ON dc.object_id = c.default_object_id
            LEFT JOIN sys.identity_columns ic ON ic.object_id = c.object_id AND ic.column_id = c.column_id
            LEFT JOIN sys.computed_columns cc ON cc.object_id = c.object_id AND cc.column_id = c.column_id
            LEFT JOIN sys.extended_properties ep
                   ON ep.class = 1 AND ep.major_id = c.object_id AND ep.minor_id = c.column_id
                  AND ep.name = 'MS_Description'
            WHERE t.is_ms_shipped = 0
            ORDER BY s.name, t.name, c.column_id
            """;

    public static final String PRIMARY_KEYS = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   kc.name AS constraint_name,
                   c.name AS column_name,
                   ic.key_ordinal AS key_ordinal,
                   CASE WHEN i.type = 1 THEN 1 ELSE 0 END AS clustered
            FROM sys.key_constraints kc
            JOIN sys.tables t ON t.object_id = kc.parent_object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            JOIN sys.indexes i ON i.object_id = kc.parent_object_id AND i.index_id = kc.unique_index_id
            JOIN sys.index_columns ic ON ic.object_id = i.object_id AND ic.index_id = i.index_id
            JOIN sys.columns c ON c.object_id = ic.object_id AND c.column_id = ic.column_id
            WHERE kc.type = 'PK'
            ORDER BY s.name, t.name, ic.key_ordinal
            """;

    // included columns have key_ordinal 0 and sort after the keys
    public static final String INDEXES = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   i.name AS index_name,
                   i.is_unique AS is_unique,
                   i.is_primary_key AS is_primary,
                   c.name AS column_name,
                   CASE WHEN ic.is_included_column = 1 THEN 1000 + ic.index_column_id
                        ELSE ic.key_ordinal END AS key_ordinal,
                   ic.is_included_column AS is_included,
                   i.type_desc AS method,
                   i.filter_definition AS filter,
                   CASE WHEN i.type = 1 THEN 1 ELSE 0 END AS clustered
            FROM sys.indexes i
            JOIN sys.tables t ON t.object_id = i.object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            JOIN sys.index_columns ic ON ic.object_id = i.object_id AND ic.index_id = i.index_id
            JOIN sys.columns c ON c.object_id = ic.object_id AND c.column_id = ic.column_id
            WHERE i.name IS NOT NULL AND t.is_ms_shipped = 0
            ORDER BY s.name, t.name, i.name, ic.key_ordinal
            """;

    public static final String FOREIGN_KEYS = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   fk.name AS constraint_name,
                   fk.object_id AS constraint_id,
                   pc.name AS column_name,
                   fkc.constraint_column_id AS key_ordinal,
                   rs.name AS ref_schema,
                   rt.name AS ref_table,
                   rc.name AS ref_column,
                   fk.delete_referential_action_desc AS on_delete,
                   fk.update_referential_action_desc AS on_update
            FROM sys.foreign_keys fk
            JOIN sys.tables t ON t.object_id = fk.parent_object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            JOIN sys.tables rt ON rt.object_id = fk.referenced_object_id
            JOIN sys.schemas rs ON rs.schema_id = rt.schema_id
            JOIN sys.foreign_key_columns fkc ON fkc.constraint_object_id = fk.object_id
            JOIN sys.columns pc ON pc.object_id = fkc.parent_object_id AND pc.column_id = fkc.parent_column_id
            JOIN sys.columns rc ON rc.object_id = fkc.referenced_object_id AND rc.column_id = fkc.referenced_column_id
            ORDER BY s.name, t.name, fk.name, fkc.constraint_column_id
            """;

    public static final String CHECKS = """
            SELECT s.name AS schema_name,
                   t.name AS table_name,
                   cc.name AS constraint_name,
                   cc.definition AS expression
            FROM sys.check_constraints cc
            JOIN sys.tables t ON t.object_id = cc.parent_object_id
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            ORDER BY s.name, t.name, cc.name
            """;

    // an indexed view has a clustered index and is stored like a table
    public static final String VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   s.name AS schema_name,
                   v.name AS view_name,
                   m.definition AS definition,
                   CASE WHEN EXISTS (SELECT 1 FROM sys.indexes i
                                      WHERE i.object_id = v.object_id AND i.index_id = 1)
                        THEN 1 ELSE 0 END AS materialized,
                   CAST(ep.value AS NVARCHAR(MAX)) AS description
            FROM sys.views v
            JOIN sys.schemas s ON s.schema_id = v.schema_id
            LEFT JOIN sys.sql_modules m ON m.object_id = v.object_id
            LEFT JOIN sys.extended_properties ep
                   ON ep.class = 1 AND ep.major_id = v.object_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            WHERE v.is_ms_shipped = 0
            ORDER BY s.name, v.name
            """;

    public static final String VIEW_COLUMNS = """
            SELECT 'COLUMN' AS row_kind,
                   s.name AS schema_name,
                   v.name AS view_name,
                   c.name AS column_name,
                   c.column_id AS ordinal,
                   ty.name AS data_type,
                   CASE WHEN ty.is_user_defined = 1 THEN SCHEMA_NAME(ty.schema_id) END AS type_schema,
                   c.max_length AS max_length,
                   c.precision AS precision,
                   c.scale AS scale,
                   c.is_nullable AS nullable
            FROM sys.columns c
            JOIN sys.views v ON v.object_id = c.object_id
            JOIN sys.schemas s ON s.schema_id = v.schema_id
            JOIN sys.types ty ON ty.user_type_id = c.user_type_id
            WHERE v.is_ms_shipped = 0
            ORDER BY s.name, v.name, c.column_id
            """;

    public static final String VIEW_DEPENDENCIES = """
            SELECT DISTINCT 'DEPENDENCY' AS row_kind,
                   s.name AS schema_name,
                   v.name AS view_name,
                   SCHEMA_NAME(o.schema_id) AS ref_schema,
                   o.name AS ref_name
            FROM sys.sql_expression_dependencies d
            JOIN sys.views v ON v.object_id = d.referencing_id
            JOIN sys.schemas s ON s.schema_id = v.schema_id
            JOIN sys.objects o ON o.object_id = d.referenced_id
            WHERE o.type IN ('U', 'V')
            """;

    public static final String ROUTINES = """
            SELECT 'ROUTINE' AS row_kind,
                   s.name AS schema_name,
                   o.name AS routine_name,
                   CAST(o.object_id AS NVARCHAR(20)) AS specific_name,
                   CASE WHEN o.type IN ('P', 'PC') THEN 'PROCEDURE' ELSE 'FUNCTION' END AS routine_type,
                   CASE WHEN o.type IN ('PC', 'FS', 'FT') THEN 'CLR' ELSE 'T-SQL' END AS language,
                   m.definition AS definition,
                   rty.name AS return_type,
                   r.max_length AS return_max_length,
                   r.precision AS return_precision,
                   r.scale AS return_scale,
                   CAST(ep.value AS NVARCHAR(MAX)) AS description
            FROM sys.objects o
            JOIN sys.schemas s ON s.schema_id = o.schema_id
            LEFT JOIN sys.sql_modules m ON m.object_id = o.object_id
            LEFT JOIN sys.parameters r ON r.object_id = o.object_id AND r.parameter_id = 0
            LEFT JOIN sys.types rty ON rty.user_type_id = r.user_type_id
            LEFT JOIN sys.extended_properties ep
                   ON ep.class = 1 AND ep.major_id = o.object_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            WHERE o.type IN ('P', 'PC', 'FN', 'IF', 'TF', 'FS', 'FT') AND o.is_ms_shipped = 0
            ORDER BY s.name, o.name
            """;

    public static final String ROUTINE_PARAMETERS = """
            SELECT 'PARAMETER' AS row_kind,
                   s.name AS schema_name,
                   CAST(o.object_id AS NVARCHAR(20)) AS specific_name,
                   p.name AS parameter_name,
                   p.parameter_id AS ordinal,
                   ty.name AS data_type,
                   CASE WHEN ty.is_user_defined = 1 THEN SCHEMA_NAME(ty.schema_id) END AS type_schema,
                   p.max_length AS max_length,
                   p.precision AS precision,
                   p.scale AS scale,
                   CASE WHEN p.is_output = 1 THEN 'OUT' ELSE 'IN' END AS mode,
                   CASE WHEN p.has_default_value = 1 THEN CAST(p.default_value AS NVARCHAR(4000)) END AS default_value
            FROM sys.parameters p
            JOIN sys.objects o ON o.object_id = p.object_id
            JOIN sys.schemas s ON s.schema_id = o.schema_id
            JOIN sys.types ty ON ty.user_type_id = p.user_type_id
            WHERE p.parameter_id > 0 AND o.is_ms_shipped = 0
              AND o.type IN ('P', 'PC', 'FN', 'IF', 'TF', 'FS', 'FT')
            ORDER BY s.name, o.name, p.parameter_id
            """;

    public static final String ROUTINE_RESULT_COLUMNS = """
            SELECT 'RESULT_COLUMN' AS row_kind,
                   s.name AS schema_name,
                   CAST(o.object_id AS NVARCHAR(20)) AS specific_name,
                   c.name AS column_name,
                   c.column_id AS ordinal,
                   ty.name AS data_type,
                   c.max_length AS max_length,
                   c.precision AS precision,
                   c.scale AS scale,
                   c.is_nullable AS nullable
            FROM sys.columns c
            JOIN sys.objects o ON o.object_id = c.object_id
            JOIN sys.schemas s ON s.schema_id = o.schema_id
            JOIN sys.types ty ON ty.user_type_id = c.user_type_id
            WHERE o.type IN ('IF', 'TF', 'FT') AND o.is_ms_shipped = 0
            ORDER BY s.name, o.name, c.column_id
            """;

    // parents may be tables or views (INSTEAD OF)
    public static final String TRIGGERS = """
            SELECT s.name AS schema_name,
                   tr.name AS trigger_name,
                   s.name AS table_schema,
                   po.name AS table_name,
                   CASE WHEN tr.is_instead_of_trigger = 1 THEN 'INSTEAD OF' ELSE 'AFTER' END AS timing,
                   OBJECTPROPERTY(tr.object_id, 'ExecIsInsertTrigger') AS is_insert,
                   OBJECTPROPERTY(tr.object_id, 'ExecIsUpdateTrigger') AS is_update,
                   OBJECTPROPERTY(tr.object_id, 'ExecIsDeleteTrigger') AS is_delete,
                   tr.is_disabled AS is_disabled,
                   m.definition AS definition
            FROM sys.triggers tr
            JOIN sys.objects po ON po.object_id = tr.parent_id
            JOIN sys.schemas s ON s.schema_id = po.schema_id
            LEFT JOIN sys.sql_modules m ON m.object_id = tr.object_id
            WHERE tr.is_ms_shipped = 0 AND tr.parent_class = 1
            ORDER BY s.name, tr.name
            """;

    public static final String TYPES = """
            SELECT 'TYPE' AS row_kind,
                   s.name AS schema_name,
                   t.name AS type_name,
                   CASE WHEN t.is_table_type = 1 THEN 'TABLE_TYPE' ELSE 'ALIAS' END AS category,
                   CASE WHEN t.is_table_type = 0 THEN bt.name END AS base_type,
                   t.max_length AS max_length,
                   t.precision AS precision,
                   t.scale AS scale,
                   CAST(ep.value AS NVARCHAR(MAX)) AS description
            FROM sys.types t
            JOIN sys.schemas s ON s.schema_id = t.schema_id
            LEFT JOIN sys.types bt ON bt.user_type_id = t.system_type_id
            LEFT JOIN sys.extended_properties ep
                   ON ep.class = 6 AND ep.major_id = t.user_type_id AND ep.minor_id = 0 AND ep.name = 'MS_Description'
            WHERE t.is_user_defined = 1 AND t.is_assembly_type = 0
            ORDER BY s.name, t.name
            """;

    public static final String TYPE_COLUMNS = """
            SELECT 'ATTRIBUTE' AS row_kind,
                   s.name AS schema_name,
                   tt.name AS type_name,
                   c.name AS column_name,
                   c.column_id AS ordinal,
                   ty.name AS data_type,
                   c.max_length AS max_length,
                   c.precision AS precision,
                   c.scale AS scale,
                   c.is_nullable AS nullable
            FROM sys.table_types tt
            JOIN sys.schemas s ON s.schema_id = tt.schema_id
            JOIN sys.columns c ON c.object_id = tt.type_table_object_id
            JOIN sys.types ty ON ty.user_type_id = c.user_type_id
            ORDER BY s.name, tt.name, c.column_id
            """;

    // sql_variant bounds are cast to DECIMAL(38) so that no value is truncated
    public static final String SEQUENCES = """
            SELECT s.name AS schema_name,
                   seq.name AS sequence_name,
                   ty.name AS data_type,
                   CAST(seq.start_value AS DECIMAL(38, 0)) AS start_value,
                   CAST(seq.minimum_value AS DECIMAL(38, 0)) AS min_value,
                   CAST(seq.maximum_value AS DECIMAL(38, 0)) AS max_value,
                   CAST(seq.increment AS DECIMAL(38, 0)) AS increment,
                   seq.is_cycling AS cycle,
                   seq.cache_size AS cache_size,
                   CAST(seq.current_value AS DECIMAL(38, 0)) AS current_value
            FROM sys.sequences seq
            JOIN sys.schemas s ON s.schema_id = seq.schema_id
            JOIN sys.types ty ON ty.user_type_id = seq.user_type_id
            ORDER BY s.name, seq.name
            """;

    public static final String SYNONYMS = """
            SELECT s.name AS schema_name,
                   syn.name AS synonym_name,
                   syn.base_object_name AS base_object_name
            FROM sys.synonyms syn
            JOIN sys.schemas s ON s.schema_id = syn.schema_id
            ORDER BY s.name, syn.name
            """;

    public static final String PRINCIPALS = """
            SELECT 'PRINCIPAL' AS row_kind,
                   dp.name AS principal_name,
                   CASE WHEN dp.type = 'R' THEN 'ROLE' ELSE 'USER' END AS principal_kind
            FROM sys.database_principals dp
            WHERE dp.type IN ('S', 'U', 'G', 'E', 'X', 'R')
              AND dp.is_fixed_role = 0
              AND dp.name NOT IN ('public', 'guest', 'INFORMATION_SCHEMA', 'sys')
            ORDER BY dp.name
            """;

    // class 0 is the database, 1 an object, 3 a schema; denials are not listed
    public static final String GRANTS = """
            SELECT 'GRANT' AS row_kind,
                   dp.name AS principal_name,
                   p.permission_name AS privilege,
                   CASE WHEN p.class = 1 THEN SCHEMA_NAME(o.schema_id) END AS object_schema,
                   CASE p.class WHEN 1 THEN o.name WHEN 3 THEN SCHEMA_NAME(p.major_id) END AS object_name
            FROM sys.database_permissions p
            JOIN sys.database_principals dp ON dp.principal_id = p.grantee_principal_id
            LEFT JOIN sys.objects o ON p.class = 1 AND o.object_id = p.major_id
            WHERE p.state IN ('G', 'W') AND p.class IN (0, 1, 3)
            """;

    public static final String MEMBERSHIPS = """
            SELECT 'MEMBERSHIP' AS row_kind,
                   m.name AS principal_name,
                   r.name AS role_name
            FROM sys.database_role_members rm
            JOIN sys.database_principals r ON r.principal_id = rm.role_principal_id
            JOIN sys.database_principals m ON m.principal_id = rm.member_principal_id
            ORDER BY m.name, r.name
            """;
}
