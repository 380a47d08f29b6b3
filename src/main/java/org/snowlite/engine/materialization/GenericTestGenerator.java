package org.snowlite.engine.materialization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.snowlite.engine.project.ColumnDoc;
import org.snowlite.engine.project.DataTest;
import org.snowlite.engine.project.Model;
import org.snowlite.engine.project.TestDeclaration;
import org.snowlite.engine.project.TestKind;
import org.snowlite.engine.project.TestStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Generates the data tests declared on a model's columns.
 *
 * Each test's SQL selects the violating rows and refers to models through
 * {@code ref()}, so it is compiled like any other template SQL before it runs.
 */
public final class GenericTestGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(GenericTestGenerator.class);

    private static final Pattern REF_ARGUMENT = Pattern.compile("\\s*ref\\s*\\(\\s*['\"](\\w+)['\"]\\s*\\)\\s*");

    private GenericTestGenerator() {
    }

    public static List<DataTest> generate(Model model) {
        List<DataTest> tests = new ArrayList<>();
        for (ColumnDoc column : model.columns()) {
            for (TestDeclaration declaration : column.tests()) {
                tests.add(generate(model.name(), column.name(), declaration));
            }
        }
        return tests;
    }

    public static DataTest generate(String model, String column, TestDeclaration declaration) {
        String id = "test_" + model + "_" + column + "_" + declaration.kind();
        return new DataTest(id, id, model, column, TestKind.SCHEMA,
                sql(model, column, declaration), declaration.severity(), TestStatus.PENDING, 0);
    }

    static String sql(String model, String column, TestDeclaration declaration) {
        String ref = "{{ ref('" + model + "') }}";
        switch (declaration.kind()) {
            case "unique":
                return "SELECT " + column + " FROM " + ref
                        + " GROUP BY " + column + " HAVING COUNT(*) > 1";
            case "not_null":
                return "SELECT * FROM " + ref + " WHERE " + column + " IS NULL";
            case "accepted_values": {
                String values = declaration.listArg("values").stream()
                        .map(v -> "'" + String.valueOf(v).replace("'", "''") + "'")
                        .collect(Collectors.joining(", "));
                if (values.isEmpty()) {
                    return "SELECT * FROM " + ref + " WHERE " + column + " IS NOT NULL";
                }
                return "SELECT * FROM " + ref + " WHERE " + column + " NOT IN (" + values + ")";
            }
            case "relationships": {
                String to = referencedModel(declaration.stringArg("to"));
                String field = declaration.stringArg("field");
                return "SELECT a." + column + " FROM " + ref + " a"
                        + " LEFT JOIN {{ ref('" + to + "') }} b ON a." + column + " = b." + field
                        + " WHERE b." + field + " IS NULL AND a." + column + " IS NOT NULL";
            }
            default:
                LOG.warn("Unknown test '{}' on {}.{}", declaration.kind(), model, column);
                return "SELECT 1 WHERE 1=0 /* Unknown test: " + declaration.kind() + " */";
        }
    }

    /**
     * Accepts both {@code customers} and {@code ref('customers')}.
     */
    private static String referencedModel(String to) {
        Matcher m = REF_ARGUMENT.matcher(to);
        return m.matches() ? m.group(1) : to.trim();
    }
}
