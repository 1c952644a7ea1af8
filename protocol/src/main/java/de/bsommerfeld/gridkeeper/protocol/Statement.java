package de.bsommerfeld.gridkeeper.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One parameterized SQL statement. Bound values are restricted to what the
 * wire format can carry: {@link String}, {@link Number}, {@link Boolean} and
 * {@code null}. The parameter list is copied and frozen on construction.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Statement(
        @JsonProperty("sql") String sql,
        @JsonProperty("params") List<Object> params) {

    public Statement {
        if (sql == null || sql.isBlank())
            throw new IllegalArgumentException("Statement SQL must not be blank");
        if (params == null) {
            params = List.of();
        } else {
            for (Object value : params) {
                if (!isWireValue(value)) {
                    throw new IllegalArgumentException("Unsupported parameter type "
                            + value.getClass().getName() + " in statement: " + sql);
                }
            }
            // List.copyOf rejects nulls, which are legal SQL values here
            params = Collections.unmodifiableList(new ArrayList<>(params));
        }
    }

    public static Statement of(String sql, Object... params) {
        return new Statement(sql, Arrays.asList(params));
    }

    private static boolean isWireValue(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean)
            return true;
        return value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof Byte || value instanceof Double || value instanceof Float
                || value instanceof BigInteger || value instanceof BigDecimal;
    }
}
