package org.jsondelta.report;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.jsondelta.engine.ComparisonResult;
import org.jsondelta.engine.DiffKind;
import org.jsondelta.engine.DiffRecord;
import org.jsondelta.path.Address;
import org.jsondelta.path.IdentityKey;
import org.jsondelta.path.IdentityKeyInfo;
import org.jsondelta.pattern.IgnoreList;
import org.jsondelta.value.BsonJson;
import org.jsondelta.value.JsonValue;
import org.jsondelta.value.JsonValues;

/**
 * Renders comparison results in markdown and JSON.
 */
public final class DiffReportGenerator {
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
        .outputMode(JsonMode.RELAXED)
        .indent(true)
        .build();
    private static final int MAX_INLINE_VALUE = 120;

    private final String leftLabel;
    private final String rightLabel;

    public DiffReportGenerator() {
        this("left", "right");
    }

    public DiffReportGenerator(String leftLabel, String rightLabel) {
        this.leftLabel = Objects.requireNonNull(leftLabel, "leftLabel");
        this.rightLabel = Objects.requireNonNull(rightLabel, "rightLabel");
    }

    public String toMarkdown(ComparisonResult result) {
        return toMarkdown(result, new IgnoreList());
    }

    public String toMarkdown(ComparisonResult result, IgnoreList ignoreList) {
        IgnoreList.Partition partition = ignoreList.partition(result.diffs());
        StringBuilder sb = new StringBuilder();
        sb.append("# JSON Diff Report\n\n");
        sb.append("- left: ").append(leftLabel).append('\n');
        sb.append("- right: ").append(rightLabel).append('\n');
        sb.append("- differences: ").append(partition.kept().size()).append('\n');
        sb.append("- added: ").append(count(partition.kept(), DiffKind.ADDED)).append('\n');
        sb.append("- removed: ").append(count(partition.kept(), DiffKind.REMOVED)).append('\n');
        sb.append("- changed: ").append(count(partition.kept(), DiffKind.CHANGED)).append('\n');
        sb.append("- ignored: ").append(partition.ignored().size()).append("\n\n");

        sb.append("## Identity Keys\n");
        if (result.identityKeys().isEmpty()) {
            sb.append("- No arrays\n\n");
        } else {
            sb.append("| Array | Key | Left | Right |\n");
            sb.append("| --- | --- | --- | --- |\n");
            for (IdentityKeyInfo info : result.identityKeys()) {
                sb.append("| `").append(display(info.arrayIdentityAddress())).append("` | ")
                    .append(info.key().map(key -> "`" + key.displayName() + "`").orElse("(index)"))
                    .append(" | ").append(info.sizeLeft())
                    .append(" | ").append(info.sizeRight())
                    .append(" |\n");
            }
            sb.append('\n');
        }

        sb.append("## Changes\n");
        if (partition.kept().isEmpty()) {
            sb.append("- No differences\n");
        }
        for (DiffRecord diff : partition.kept()) {
            appendDiffLine(sb, diff);
        }
        if (!partition.ignored().isEmpty()) {
            sb.append("\n## Ignored\n");
            for (String pattern : ignoreList.patterns()) {
                sb.append("- pattern `").append(pattern).append("`\n");
            }
            for (DiffRecord diff : partition.ignored()) {
                appendDiffLine(sb, diff);
            }
        }
        return sb.toString();
    }

    public String toJson(ComparisonResult result) {
        return toJson(result, new IgnoreList());
    }

    public String toJson(ComparisonResult result, IgnoreList ignoreList) {
        IgnoreList.Partition partition = ignoreList.partition(result.diffs());
        BsonDocument root = new BsonDocument();
        root.put("left", new BsonString(leftLabel));
        root.put("right", new BsonString(rightLabel));

        BsonDocument summary = new BsonDocument();
        summary.put("differences", new BsonInt32(partition.kept().size()));
        summary.put("added", new BsonInt32(count(partition.kept(), DiffKind.ADDED)));
        summary.put("removed", new BsonInt32(count(partition.kept(), DiffKind.REMOVED)));
        summary.put("changed", new BsonInt32(count(partition.kept(), DiffKind.CHANGED)));
        summary.put("ignored", new BsonInt32(partition.ignored().size()));
        root.put("summary", summary);

        BsonArray keys = new BsonArray();
        for (IdentityKeyInfo info : result.identityKeys()) {
            BsonDocument item = new BsonDocument();
            item.put("array", new BsonString(info.arrayIdentityAddress().text()));
            item.put("arrayAddress", new BsonString(info.arrayAddress().text()));
            item.put("arrayPattern", new BsonString(info.arrayPattern().text()));
            item.put("key", info.key().<BsonValue>map(key -> keyFields(key)).orElse(BsonNull.VALUE));
            item.put("composite", BsonBoolean.valueOf(info.isComposite()));
            item.put("sizeLeft", new BsonInt32(info.sizeLeft()));
            item.put("sizeRight", new BsonInt32(info.sizeRight()));
            item.put("sharedAcrossPattern", BsonBoolean.valueOf(info.sharedAcrossPattern()));
            keys.add(item);
        }
        root.put("identityKeys", keys);
        root.put("diffs", diffArray(partition.kept()));
        root.put("ignored", diffArray(partition.ignored()));
        root.put("ignorePatterns", stringArray(ignoreList.patterns()));
        return root.toJson(JSON_SETTINGS);
    }

    private static BsonArray diffArray(List<DiffRecord> diffs) {
        BsonArray items = new BsonArray();
        for (DiffRecord diff : diffs) {
            BsonDocument item = new BsonDocument();
            item.put("kind", new BsonString(diff.kind().name()));
            item.put("identityAddress", new BsonString(diff.identityAddress().text()));
            item.put("leftAddress", addressValue(diff.leftAddress()));
            item.put("rightAddress", addressValue(diff.rightAddress()));
            item.put("oldValue", diff.oldValue().map(BsonJson::toBson).orElse(BsonNull.VALUE));
            item.put("newValue", diff.newValue().map(BsonJson::toBson).orElse(BsonNull.VALUE));
            item.put("identityKey", diff.identityKey().<BsonValue>map(key -> keyFields(key)).orElse(BsonNull.VALUE));
            items.add(item);
        }
        return items;
    }

    private static BsonValue addressValue(Optional<? extends Address> address) {
        return address.<BsonValue>map(value -> new BsonString(value.text())).orElse(BsonNull.VALUE);
    }

    private static BsonArray keyFields(IdentityKey key) {
        return stringArray(key.fields());
    }

    private static BsonArray stringArray(List<String> values) {
        BsonArray array = new BsonArray();
        for (String value : values) {
            array.add(new BsonString(value));
        }
        return array;
    }

    private void appendDiffLine(StringBuilder sb, DiffRecord diff) {
        sb.append("- ").append(diff.kind()).append(" `").append(display(diff.identityAddress())).append("`: ");
        switch (diff.kind()) {
            case ADDED -> sb.append(inline(diff.newValue().orElseThrow()));
            case REMOVED -> sb.append(inline(diff.oldValue().orElseThrow()));
            case CHANGED -> sb.append(inline(diff.oldValue().orElseThrow()))
                .append(" -> ")
                .append(inline(diff.newValue().orElseThrow()));
        }
        StringBuilder where = new StringBuilder();
        diff.leftAddress().ifPresent(address -> where.append(leftLabel).append(" `").append(display(address)).append('`'));
        diff.rightAddress().ifPresent(address -> {
            if (where.length() > 0) {
                where.append(", ");
            }
            where.append(rightLabel).append(" `").append(display(address)).append('`');
        });
        if (where.length() > 0 && !positionsMatchIdentity(diff)) {
            sb.append(" (").append(where).append(')');
        }
        sb.append('\n');
    }

    private static boolean positionsMatchIdentity(DiffRecord diff) {
        String identity = diff.identityAddress().text();
        return diff.leftAddress().map(address -> address.text().equals(identity)).orElse(true)
            && diff.rightAddress().map(address -> address.text().equals(identity)).orElse(true);
    }

    private static String inline(JsonValue value) {
        String rendered = JsonValues.render(value);
        if (rendered.codePointCount(0, rendered.length()) > MAX_INLINE_VALUE) {
            rendered = rendered.substring(0, rendered.offsetByCodePoints(0, MAX_INLINE_VALUE)) + "...";
        }
        return codeSpan(rendered);
    }

    // fence one backtick longer than the longest backtick run inside the text
    private static String codeSpan(String text) {
        int longest = 0;
        int run = 0;
        for (int i = 0; i < text.length(); i++) {
            run = text.charAt(i) == '`' ? run + 1 : 0;
            longest = Math.max(longest, run);
        }
        String fence = "`".repeat(longest + 1);
        String padding = longest > 0 && (text.startsWith("`") || text.endsWith("`")) ? " " : "";
        return fence + padding + text + padding + fence;
    }

    private static String display(Address address) {
        return address.isRoot() ? "<root>" : address.text();
    }

    private static int count(List<DiffRecord> diffs, DiffKind kind) {
        int total = 0;
        for (DiffRecord diff : diffs) {
            if (diff.kind() == kind) {
                total++;
            }
        }
        return total;
    }
}
