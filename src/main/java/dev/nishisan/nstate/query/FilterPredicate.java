/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura at gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.nstate.query;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;

/**
 * One {@code (field, operator, value)} condition. Values are compared in string form.
 */
public record FilterPredicate(String field, FilterOperator operator, String value) implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    public FilterPredicate {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(value, "value");
        if (field.isBlank()) {
            throw new IllegalArgumentException("filter field must not be blank");
        }
    }

    public static FilterPredicate eq(String field, Object value) {
        return new FilterPredicate(field, FilterOperator.EQUALS, String.valueOf(value));
    }

    public static FilterPredicate ne(String field, Object value) {
        return new FilterPredicate(field, FilterOperator.NOT_EQUALS, String.valueOf(value));
    }

    /**
     * Parses the command line form {@code field=value} or {@code field!=value}. Surrounding
     * whitespace of field and value is dropped.
     */
    public static FilterPredicate parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        int notEquals = expression.indexOf("!=");
        int equals = expression.indexOf('=');
        if (equals < 0) {
            throw invalid(expression);
        }
        boolean negated = notEquals >= 0 && notEquals < equals;
        int operatorAt = negated ? notEquals : equals;
        String field = expression.substring(0, operatorAt).trim();
        if (field.isEmpty() || field.endsWith("!")) {
            throw invalid(expression);
        }
        String value = expression.substring(operatorAt + (negated ? 2 : 1)).trim();
        return new FilterPredicate(field, negated ? FilterOperator.NOT_EQUALS : FilterOperator.EQUALS, value);
    }

    private static IllegalArgumentException invalid(String expression) {
        return new IllegalArgumentException("Invalid filter '" + expression + "', expected field=value or field!=value");
    }

    @Override
    public String toString() {
        return field + operator.symbol() + value;
    }
}
