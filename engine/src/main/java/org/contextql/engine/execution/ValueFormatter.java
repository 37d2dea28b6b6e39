package org.contextql.engine.execution;

import org.contextql.engine.plan.OutputColumn;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Applies metric display formats to result values.
 *
 * Named formats map to fixed patterns; anything else is tried as a
 * {@link DecimalFormat} pattern. Values that are not numbers, and formats that
 * are not valid patterns, pass through unchanged. {@code percent} treats the
 * value as a fraction ({@code 0.125} renders as {@code 12.50%}).
 */
public final class ValueFormatter {

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private ValueFormatter() {
    }

    /**
     * @return The pattern a format name stands for, or the name itself
     */
    static String pattern(String format) {
        return switch (format.strip().toLowerCase(Locale.ROOT)) {
            case "currency" -> "$#,##0.00";
            case "percent", "percentage" -> "0.00%";
            case "integer" -> "#,##0";
            case "decimal", "number" -> "#,##0.00";
            default -> format.strip();
        };
    }

    public static Object format(Object value, String format) {
        if (format == null || format.isBlank() || !isNumeric(value)) {
            return value;
        }
        DecimalFormat decimalFormat;
        try {
            // DecimalFormat is not thread-safe; build one per call
            decimalFormat = new DecimalFormat(pattern(format), SYMBOLS);
        } catch (IllegalArgumentException e) {
            return value;
        }
        if (value instanceof BigDecimal || value instanceof BigInteger) {
            return decimalFormat.format(value);
        }
        return decimalFormat.format(((Number) value).doubleValue());
    }

    /**
     * Formats every metric column of a result that declares a display format.
     */
    public static BufferedResult format(BufferedResult result, List<OutputColumn> outputs) {
        List<Integer> indexes = new ArrayList<>();
        List<String> formats = new ArrayList<>();
        for (OutputColumn output : outputs) {
            if (output.metric() && output.format() != null && !output.format().isBlank()) {
                int index = result.columnIndex(output.name());
                if (index >= 0) {
                    indexes.add(index);
                    formats.add(output.format());
                }
            }
        }
        if (indexes.isEmpty()) {
            return result;
        }
        List<Row> rows = new ArrayList<>(result.rows().size());
        for (Row row : result.rows()) {
            List<Object> values = new ArrayList<>(row.values());
            for (int i = 0; i < indexes.size(); i++) {
                int index = indexes.get(i);
                values.set(index, format(values.get(index), formats.get(i)));
            }
            rows.add(new Row(values));
        }
        return new BufferedResult(result.columns(), rows);
    }

    private static boolean isNumeric(Object value) {
        return value instanceof Number;
    }
}
