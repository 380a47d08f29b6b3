package org.snowlite.engine.execution;

import java.sql.Types;

/**
 * Column metadata of a statement result.
 */
public record Column(String name, String sqlType, String javaType) {

    /**
     * Maps a JDBC type code to a Java type name.
     */
    public static String mapJdbcTypeToJava(int jdbcType) {
        return switch (jdbcType) {
            case Types.VARCHAR, Types.CHAR, Types.LONGVARCHAR -> "String";
            case Types.INTEGER, Types.SMALLINT, Types.TINYINT -> "Integer";
            case Types.BIGINT -> "Long";
            case Types.DOUBLE, Types.FLOAT, Types.REAL -> "Double";
            case Types.DECIMAL, Types.NUMERIC -> "BigDecimal";
            case Types.BOOLEAN, Types.BIT -> "Boolean";
            case Types.DATE -> "LocalDate";
            case Types.TIMESTAMP, Types.TIMESTAMP_WITH_TIMEZONE -> "LocalDateTime";
            default -> "Object";
        };
    }
}
