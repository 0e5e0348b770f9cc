package org.recdiff.report;

import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.recdiff.engine.ChangeEntry;
import org.recdiff.engine.ChangeKind;
import org.recdiff.engine.Diff;
import org.recdiff.obs.BsonValues;

/**
 * Renders a {@link Diff} in markdown and JSON, for display and debugging.
 */
public final class DiffReportRenderer {
    private static final JsonWriterSettings REPORT_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();

    public String toMarkdown(Diff diff) {
        Objects.requireNonNull(diff, "diff");
        StringBuilder sb = new StringBuilder();
        sb.append("# Diff Report\n\n");
        sb.append("- types: ").append(diff.baseTypeName()).append(" vs ").append(diff.otherTypeName()).append('\n');
        sb.append("- total: ").append(diff.size()).append('\n');
        for (ChangeKind kind : ChangeKind.values()) {
            sb.append("- ").append(kind.token()).append(": ").append(diff.count(kind)).append('\n');
        }
        sb.append('\n');

        if (diff.isEmpty()) {
            sb.append("- No differences\n");
            return sb.toString();
        }
        for (ChangeEntry entry : diff.entries()) {
            sb.append("- ").append(entry.kind().displayName()).append(" `").append(entry.location()).append('`');
            if (!entry.basePath().equals(entry.otherPath())) {
                sb.append(" (base `").append(entry.basePath().path())
                    .append("`, other `").append(entry.otherPath().path()).append("`)");
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String toJson(Diff diff) {
        Objects.requireNonNull(diff, "diff");
        BsonDocument summary = new BsonDocument("total", new BsonInt32(diff.size()));
        for (ChangeKind kind : ChangeKind.values()) {
            summary.append(kind.token(), new BsonInt32(diff.count(kind)));
        }

        BsonArray entries = new BsonArray();
        for (ChangeEntry entry : diff.entries()) {
            entries.add(new BsonDocument()
                .append("kind", new BsonString(entry.kind().token()))
                .append("base", BsonValues.of(entry.basePath().components()))
                .append("other", BsonValues.of(entry.otherPath().components()))
                .append("path", new BsonString(entry.location())));
        }

        return new BsonDocument()
            .append("baseType", new BsonString(diff.baseTypeName()))
            .append("otherType", new BsonString(diff.otherTypeName()))
            .append("summary", summary)
            .append("entries", entries)
            .toJson(REPORT_SETTINGS);
    }
}
