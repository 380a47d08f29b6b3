package org.snowlite.engine.template;

import org.snowlite.engine.project.ProjectConfig;
import org.snowlite.engine.project.Snapshot;
import org.snowlite.engine.project.SnapshotStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code {% snapshot name %} ... {% endsnapshot %}} blocks into snapshots.
 *
 * The block body, config block included, becomes the snapshot's raw SQL; the
 * compiler strips the config again when the snapshot runs.
 */
public final class SnapshotBlockParser {

    private static final Pattern SNAPSHOT_BLOCK = Pattern.compile(
            "\\{%-?\\s*snapshot\\s+(\\w+)\\s*-?%}(.*?)\\{%-?\\s*endsnapshot\\s*-?%}", Pattern.DOTALL);

    private SnapshotBlockParser() {
    }

    public static List<Snapshot> parse(String text, ProjectConfig config) {
        List<Snapshot> snapshots = new ArrayList<>();
        Matcher m = SNAPSHOT_BLOCK.matcher(text);
        while (m.find()) {
            String body = m.group(2);
            Map<String, Object> settings = ConfigBlockParser.extract(body).config();
            String schema = stringValue(settings.get("target_schema"), config.schema()).toUpperCase(Locale.ROOT);
            snapshots.add(new Snapshot(
                    m.group(1),
                    stringValue(settings.get("target_database"), config.database()),
                    schema,
                    SnapshotStrategy.fromValue(stringValue(settings.get("strategy"), "timestamp")),
                    stringValue(settings.get("unique_key"), "id"),
                    stringValue(settings.get("updated_at"), null),
                    checkCols(settings.get("check_cols")),
                    body.strip(),
                    "",
                    Boolean.TRUE.equals(settings.get("invalidate_hard_deletes"))));
        }
        return snapshots;
    }

    private static List<String> checkCols(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        String text = String.valueOf(value).trim();
        if (text.equalsIgnoreCase("all")) {
            return List.of("*");
        }
        return List.of(text.split("\\s*,\\s*"));
    }

    private static String stringValue(Object value, String fallback) {
        return value == null ? fallback : String.valueOf(value);
    }
}
