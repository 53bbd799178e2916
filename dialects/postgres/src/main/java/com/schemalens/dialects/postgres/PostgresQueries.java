package com.schemalens.dialects.postgres;

/**
 * Catalog queries for PostgreSQL 12 and later, read from {@code pg_catalog}.
 *
 * Queries return every schema except TOAST and temporary ones and leave schema filtering
 * to the extractor. Ordering is left to the model, which sorts on assembly.
 */
public final class PostgresQueries {
    private PostgresQueries() {}

    public static final String DESCRIBE = """
            SELECT current_database() AS database_name,
                   current_setting('server_version') AS version,
                   current_schema() AS default_schema
            """;

    public static final String SCHEMAS = """
            SELECT n.nspname AS schema_name
            FROM pg_namespace n
            WHERE n.nspname NOT LIKE 'pg\\_toast%'
              AND n.nspname NOT LIKE 'pg\\_temp\\_%'
            ORDER BY n.nspname
            """;

    public static final String TABLES = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   c.reltuples::bigint AS row_count,
                   pg_total_relation_size(c.oid) / 1024 AS size_kb,
                   obj_description(c.oid, 'pg_class') AS description
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind IN ('r', 'p')
              AND n.nspname NOT LIKE 'pg\\_toast%'
              AND n.nspname NOT LIKE 'pg\\_temp\\_%'
            """;

    public static final String COLUMNS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   a.attname AS column_name,
                   a.attnum AS ordinal,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS nullable,
                   CASE WHEN a.attgenerated = '' THEN pg_get_expr(d.adbin, d.adrelid) END AS default_value,
                   a.attidentity AS identity_kind,
                   CASE WHEN a.attgenerated = 's' THEN pg_get_expr(d.adbin, d.adrelid) END AS generation_expression,
                   seq.seqstart AS identity_seed,
                   seq.seqincrement AS identity_increment,
                   col_description(c.oid, a.attnum) AS description
            FROM pg_attribute a
            JOIN pg_class c ON c.oid = a.attrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            LEFT JOIN pg_attrdef d ON d.adrelid = a.attrelid AND d.adnum = a.attnum
            LEFT JOIN pg_sequence seq
                   ON seq.seqrelid = pg_get_serial_sequence(format('%I.%I', n.nspname, c.relname), a.attname)::regclass
            WHERE c.relkind IN ('r', 'p')
              AND a.attnum > 0
              AND NOT a.attisdropped
              AND n.nspname NOT LIKE 'pg\\_toast%'
              AND n.nspname NOT LIKE 'pg\\_temp\\_%'
            """;

    public static final String PRIMARY_KEYS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   con.conname AS constraint_name,
                   a.attname AS column_name,
                   k.ord AS key_ordinal,
                   ix.indisclustered AS clustered
            FROM pg_constraint con
            JOIN pg_class c ON c.oid = con.conrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            JOIN pg_index ix ON ix.indexrelid = con.conindid
            CROSS JOIN LATERAL unnest(con.conkey) WITH ORDINALITY AS k(attnum, ord)
            JOIN pg_attribute a ON a.attrelid = c.oid AND a.attnum = k.attnum
            WHERE con.contype = 'p'
              AND c.relkind IN ('r', 'p')
            """;

    public static final String INDEXES = """
            SELECT n.nspname AS schema_name,
                   t.relname AS table_name,
                   i.relname AS index_name,
                   ix.indisunique AS is_unique,
                   ix.indisprimary AS is_primary,
                   a.attname AS column_name,
                   CASE WHEN k.attnum = 0 THEN pg_get_indexdef(ix.indexrelid, k.ord::int, true) END AS expression,
                   k.ord AS key_ordinal,
                   k.ord > ix.indnkeyatts AS is_included,
                   upper(am.amname) AS method,
                   pg_get_expr(ix.indpred, ix.indrelid, true) AS filter,
                   ix.indisclustered AS clustered
            FROM pg_index ix
            JOIN pg_class i ON i.oid = ix.indexrelid
            JOIN pg_class t ON t.oid = ix.indrelid
            JOIN pg_namespace n ON n.oid = t.relnamespace
            JOIN pg_am am ON am.oid = i.relam
            CROSS JOIN LATERAL unnest(ix.indkey::int2[]) WITH ORDINALITY AS k(attnum, ord)
            LEFT JOIN pg_attribute a ON a.attrelid = t.oid AND a.attnum = k.attnum AND k.attnum > 0
            WHERE t.relkind IN ('r', 'p')
              AND n.nspname NOT LIKE 'pg\\_toast%'
              AND n.nspname NOT LIKE 'pg\\_temp\\_%'
            """;

    public static final String FOREIGN_KEYS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   con.conname AS constraint_name,
                   a.attname AS column_name,
                   k.ord AS key_ordinal,
                   rn.nspname AS ref_schema,
                   rc.relname AS ref_table,
                   ra.attname AS ref_column,
                   con.confdeltype AS on_delete,
                   con.confupdtype AS on_update
            FROM pg_constraint con
            JOIN pg_class c ON c.oid = con.conrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            JOIN pg_class rc ON rc.oid = con.confrelid
            JOIN pg_namespace rn ON rn.oid = rc.relnamespace
            CROSS JOIN LATERAL unnest(con.conkey, con.confkey) WITH ORDINALITY AS k(attnum, ref_attnum, ord)
            JOIN pg_attribute a ON a.attrelid = con.conrelid AND a.attnum = k.attnum
            JOIN pg_attribute ra ON ra.attrelid = con.confrelid AND ra.attnum = k.ref_attnum
            WHERE con.contype = 'f'
            """;

    public static final String CHECKS = """
            SELECT n.nspname AS schema_name,
                   c.relname AS table_name,
                   con.conname AS constraint_name,
                   pg_get_constraintdef(con.oid, true) AS expression
            FROM pg_constraint con
            JOIN pg_class c ON c.oid = con.conrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE con.contype = 'c'
              AND c.relkind IN ('r', 'p')
            """;

    public static final String VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   n.nspname AS schema_name,
                   c.relname AS view_name,
                   pg_get_viewdef(c.oid, true) AS definition,
                   c.relkind = 'm' AS materialized,
                   obj_description(c.oid, 'pg_class') AS description
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind IN ('v', 'm')
            """;

    public static final String VIEW_COLUMNS = """
            SELECT 'COLUMN' AS row_kind,
                   n.nspname AS schema_name,
                   c.relname AS view_name,
                   a.attname AS column_name,
                   a.attnum AS ordinal,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS nullable
            FROM pg_attribute a
            JOIN pg_class c ON c.oid = a.attrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE c.relkind IN ('v', 'm')
              AND a.attnum > 0
              AND NOT a.attisdropped
            """;

    public static final String VIEW_DEPENDENCIES = """
            SELECT DISTINCT 'DEPENDENCY' AS row_kind,
                   vn.nspname AS schema_name,
                   v.relname AS view_name,
                   rn.nspname AS ref_schema,
                   r.relname AS ref_name
            FROM pg_rewrite rw
            JOIN pg_class v ON v.oid = rw.ev_class
            JOIN pg_namespace vn ON vn.oid = v.relnamespace
            JOIN pg_depend d ON d.classid = 'pg_rewrite'::regclass
                            AND d.objid = rw.oid
                            AND d.refclassid = 'pg_class'::regclass
            JOIN pg_class r ON r.oid = d.refobjid
            JOIN pg_namespace rn ON rn.oid = r.relnamespace
            WHERE v.relkind IN ('v', 'm')
              AND r.oid <> v.oid
            """;

    public static final String ROUTINES = """
            SELECT 'ROUTINE' AS row_kind,
                   n.nspname AS schema_name,
                   p.proname AS routine_name,
                   p.oid::text AS specific_name,
                   CASE p.prokind WHEN 'p' THEN 'PROCEDURE' ELSE 'FUNCTION' END AS routine_type,
                   l.lanname AS language,
                   CASE WHEN p.prokind <> 'a' THEN pg_get_functiondef(p.oid) END AS definition,
                   CASE
                       WHEN p.prokind = 'p' THEN NULL
                       WHEN 't' = ANY(COALESCE(p.proargmodes, ARRAY[]::"char"[])) THEN NULL
                       ELSE pg_get_function_result(p.oid)
                   END AS return_type,
                   obj_description(p.oid, 'pg_proc') AS description,
                   pg_get_function_identity_arguments(p.oid) AS identity_args
            FROM pg_proc p
            JOIN pg_namespace n ON n.oid = p.pronamespace
            JOIN pg_language l ON l.oid = p.prolang
            """;

    public static final String ROUTINE_ARGUMENTS = """
            SELECT CASE WHEN args.mode = 't' THEN 'RESULT_COLUMN' ELSE 'PARAMETER' END AS row_kind,
                   n.nspname AS schema_name,
                   p.oid::text AS specific_name,
                   args.name AS parameter_name,
                   args.name AS column_name,
                   args.ord AS ordinal,
                   format_type(args.type_oid, NULL) AS data_type,
                   CASE args.mode WHEN 'o' THEN 'OUT' WHEN 'b' THEN 'INOUT' ELSE 'IN' END AS mode,
                   ip.parameter_default AS default_value
            FROM pg_proc p
            JOIN pg_namespace n ON n.oid = p.pronamespace
            CROSS JOIN LATERAL unnest(
                    COALESCE(p.proallargtypes, p.proargtypes::oid[]),
                    COALESCE(p.proargmodes, array_fill('i'::"char", ARRAY[cardinality(p.proargtypes::oid[])])),
                    p.proargnames) WITH ORDINALITY AS args(type_oid, mode, name, ord)
            LEFT JOIN information_schema.parameters ip
                   ON ip.specific_schema = n.nspname
                  AND ip.specific_name = p.proname || '_' || p.oid
                  AND ip.ordinal_position = args.ord
            """;

    public static final String TRIGGERS = """
            SELECT n.nspname AS schema_name,
                   t.tgname AS trigger_name,
                   n.nspname AS table_schema,
                   c.relname AS table_name,
                   t.tgtype AS tgtype,
                   t.tgenabled AS tgenabled,
                   pg_get_triggerdef(t.oid, true) AS definition
            FROM pg_trigger t
            JOIN pg_class c ON c.oid = t.tgrelid
            JOIN pg_namespace n ON n.oid = c.relnamespace
            WHERE NOT t.tgisinternal
            """;

    public static final String TYPES = """
            SELECT 'TYPE' AS row_kind,
                   n.nspname AS schema_name,
                   t.typname AS type_name,
                   CASE t.typtype WHEN 'c' THEN 'COMPOSITE' WHEN 'e' THEN 'ENUM' ELSE 'DOMAIN' END AS category,
                   CASE WHEN t.typtype = 'd' THEN format_type(t.typbasetype, t.typtypmod) END AS base_type,
                   (SELECT string_agg(pg_get_constraintdef(con.oid, true), ' AND ' ORDER BY con.conname)
                    FROM pg_constraint con
                    WHERE con.contypid = t.oid) AS check_expression,
                   obj_description(t.oid, 'pg_type') AS description
            FROM pg_type t
            JOIN pg_namespace n ON n.oid = t.typnamespace
            LEFT JOIN pg_class rel ON rel.oid = t.typrelid
            WHERE t.typtype IN ('c', 'e', 'd')
              AND (t.typtype <> 'c' OR rel.relkind = 'c')
            """;

    public static final String TYPE_ATTRIBUTES = """
            SELECT 'ATTRIBUTE' AS row_kind,
                   n.nspname AS schema_name,
                   t.typname AS type_name,
                   a.attname AS attribute_name,
                   a.attnum AS ordinal,
                   format_type(a.atttypid, a.atttypmod) AS data_type,
                   NOT a.attnotnull AS nullable
            FROM pg_type t
            JOIN pg_namespace n ON n.oid = t.typnamespace
            JOIN pg_class rel ON rel.oid = t.typrelid AND rel.relkind = 'c'
            JOIN pg_attribute a ON a.attrelid = rel.oid AND a.attnum > 0 AND NOT a.attisdropped
            """;

    public static final String ENUM_VALUES = """
            SELECT 'ENUM_VALUE' AS row_kind,
                   n.nspname AS schema_name,
                   t.typname AS type_name,
                   e.enumlabel AS value,
                   row_number() OVER (PARTITION BY e.enumtypid ORDER BY e.enumsortorder) AS ordinal
            FROM pg_enum e
            JOIN pg_type t ON t.oid = e.enumtypid
            JOIN pg_namespace n ON n.oid = t.typnamespace
            """;

    public static final String SEQUENCES = """
            SELECT s.schemaname AS schema_name,
                   s.sequencename AS sequence_name,
                   s.data_type::text AS data_type,
                   s.start_value,
                   s.min_value,
                   s.max_value,
                   s.increment_by AS increment,
                   s.cycle,
                   s.cache_size,
                   s.last_value AS current_value
            FROM pg_sequences s
            """;

    public static final String PRINCIPALS = """
            SELECT 'PRINCIPAL' AS row_kind,
                   r.rolname AS principal_name,
                   CASE WHEN r.rolcanlogin THEN 'USER' ELSE 'ROLE' END AS principal_kind
            FROM pg_roles r
            WHERE r.rolname NOT LIKE 'pg\\_%'
            """;

    public static final String GRANTS = """
            SELECT 'GRANT' AS row_kind,
                   g.rolname AS principal_name,
                   acl.privilege_type AS privilege,
                   n.nspname AS object_schema,
                   c.relname AS object_name
            FROM pg_class c
            JOIN pg_namespace n ON n.oid = c.relnamespace
            CROSS JOIN LATERAL aclexplode(c.relacl) acl
            JOIN pg_roles g ON g.oid = acl.grantee
            WHERE c.relkind IN ('r', 'p', 'v', 'm', 'S')
              AND n.nspname NOT IN ('pg_catalog', 'information_schema')
              AND n.nspname NOT LIKE 'pg\\_toast%'
            UNION ALL
            SELECT 'GRANT',
                   g.rolname,
                   acl.privilege_type,
                   n.nspname,
                   p.proname
            FROM pg_proc p
            JOIN pg_namespace n ON n.oid = p.pronamespace
            CROSS JOIN LATERAL aclexplode(p.proacl) acl
            JOIN pg_roles g ON g.oid = acl.grantee
            WHERE n.nspname NOT IN ('pg_catalog', 'information_schema')
            UNION ALL
            SELECT 'GRANT',
                   g.rolname,
                   acl.privilege_type,
                   NULL,
                   n.nspname
            FROM pg_namespace n
            CROSS JOIN LATERAL aclexplode(n.nspacl) acl
            JOIN pg_roles g ON g.oid = acl.grantee
            WHERE n.nspname NOT IN ('pg_catalog', 'information_schema')
              AND n.nspname NOT LIKE 'pg\\_toast%'
            """;

    public static final String MEMBERSHIPS = """
            SELECT 'MEMBERSHIP' AS row_kind,
                   m.rolname AS principal_name,
                   r.rolname AS role_name
            FROM pg_auth_members am
            JOIN pg_roles m ON m.oid = am.member
            JOIN pg_roles r ON r.oid = am.roleid
            WHERE m.rolname NOT LIKE 'pg\\_%'
            """;
}
