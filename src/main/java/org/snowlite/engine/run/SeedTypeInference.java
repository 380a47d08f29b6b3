package org.snowlite.engine.run;

import org.snowlite.engine.project.SeedColumn;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Infers a column type per seed column from the non-empty values of the first
 * {@value #SAMPLE_ROWS} rows. The first type every sampled value fits wins, in
 * the order INTEGER (BIGINT when a value exceeds the int range), DOUBLE, BOOLEAN,
 * TIMESTAMP, VARCHAR. A column with no sampled values is VARCHAR.
 */
public final class SeedTypeInference {

    static final int SAMPLE_ROWS = 100;

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern ISO_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern ISO_DATETIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}.*");
    static final Pattern US_DATE = Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$");

    private SeedTypeInference() {
    }

    public static List<SeedColumn> infer(SeedData data) {
        List<SeedColumn> columns = new ArrayList<>();
        int sample = Math.min(SAMPLE_ROWS, data.rows().size());
        for (int c = 0; c < data.header().size(); c++) {
            List<String> values = new ArrayList<>();
            for (int r = 0; r < sample; r++) {
                String value = data.cell(r, c).trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            columns.add(new SeedColumn(data.header().get(c).trim(), typeOf(values)));
        }
        return columns;
    }

    static String typeOf(List<String> values) {
        if (values.isEmpty()) {
            return "VARCHAR";
        }
        if (values.stream().allMatch(v -> INTEGER.matcher(v).matches())) {
            return values.stream().allMatch(SeedTypeInference::fitsInt) ? "INTEGER" : "BIGINT";
        }
        if (values.stream().allMatch(SeedTypeInference::isDouble)) {
            return "DOUBLE";
        }
        if (values.stream().allMatch(SeedTypeInference::isBoolean)) {
            return "BOOLEAN";
        }
        if (values.stream().allMatch(SeedTypeInference::isTimestamp)) {
            return "TIMESTAMP";
        }
        return "VARCHAR";
    }

    private static boolean fitsInt(String value) {
        try {
            Integer.parseInt(value);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isDouble(String value) {
        try {
            Double.parseDouble(value);
            return !value.endsWith("d") && !value.endsWith("D") && !value.endsWith("f") && !value.endsWith("F");
        } catch (NumberFormatException e) {
            return false;
        }
    }

    static boolean isBoolean(String value) {
        String v = value.toLowerCase(Locale.ROOT);
        return v.equals("true") || v.equals("false") || v.equals("0") || v.equals("1");
    }

    private static boolean isTimestamp(String value) {
        return ISO_DATE.matcher(value).matches()
                || ISO_DATETIME.matcher(value).matches()
                || US_DATE.matcher(value).matches();
    }
}
