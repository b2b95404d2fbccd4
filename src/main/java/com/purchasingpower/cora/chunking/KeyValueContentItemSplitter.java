package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.FormatFamily;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.util.TextLines;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits configuration files into top-level key groups.
 *
 * <ul>
 *   <li>YAML: every unindented {@code key:} line opens a group</li>
 *   <li>TOML: every {@code [table]} header opens a group, as do bare keys before the first table</li>
 *   <li>JSON: every key of the outermost object opens a group</li>
 *   <li>properties: consecutive keys sharing their first dotted segment form one group</li>
 * </ul>
 */
@Component
public class KeyValueContentItemSplitter implements ContentItemSplitter {

    private static final Pattern YAML_KEY = Pattern.compile("^([^\\s#\\-][^:#]*?)\\s*:(\\s.*)?$");
    private static final Pattern TOML_TABLE = Pattern.compile("^\\s*\\[\\[?\\s*([^\\]]+?)\\s*]]?\\s*(#.*)?$");
    private static final Pattern TOML_KEY = Pattern.compile("^([A-Za-z0-9_\\-.\"']+)\\s*=");
    private static final Pattern JSON_KEY = Pattern.compile("^\\s*\"((?:[^\"\\\\]|\\\\.)*)\"\\s*:");
    private static final Pattern PROPERTY_KEY = Pattern.compile("^([^#!\\s=:][^=:\\s]*)\\s*[=:]");

    @Override
    public boolean supports(Language language) {
        return language.getFamily() == FormatFamily.KEY_VALUE;
    }

    @Override
    public List<ContentItem> split(TextLines lines, Language language) {
        List<Integer> starts = new ArrayList<>();
        List<String> keys = new ArrayList<>();
        boolean inTable = false;
        String currentGroup = null;
        int depth = 0;

        for (int n = 1; n <= lines.count(); n++) {
            String line = lines.line(n);
            String key = switch (language) {
                case YAML -> match(YAML_KEY, line);
                case JSON -> depth == 1 ? match(JSON_KEY, line) : null;
                case TOML -> {
                    String table = match(TOML_TABLE, line);
                    if (table != null) {
                        inTable = true;
                        yield table;
                    }
                    yield inTable ? null : match(TOML_KEY, line);
                }
                default -> {
                    String property = match(PROPERTY_KEY, line);
                    if (property == null) {
                        yield null;
                    }
                    String group = firstSegment(property);
                    yield Objects.equals(group, currentGroup) ? null : group;
                }
            };
            if (language == Language.JSON) {
                depth += nesting(line);
            }
            if (key != null) {
                starts.add(n);
                keys.add(key);
                currentGroup = key;
            }
        }

        List<ContentItem> items = new ArrayList<>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int end = i + 1 < starts.size() ? starts.get(i + 1) - 1 : lines.count();
            items.add(ContentItem.heuristic(keys.get(i), EntityType.KEY, starts.get(i), end));
        }
        return items;
    }

    private static String match(Pattern pattern, String line) {
        Matcher matcher = pattern.matcher(line);
        return matcher.find() ? stripQuotes(matcher.group(1).trim()) : null;
    }

    /** Net change of object and array depth over one line, ignoring brackets inside strings. */
    private static int nesting(String line) {
        int change = 0;
        boolean inString = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                change++;
            } else if (c == '}' || c == ']') {
                change--;
            }
        }
        return change;
    }

    private static String firstSegment(String key) {
        int dot = key.indexOf('.');
        return dot > 0 ? key.substring(0, dot) : key;
    }

    private static String stripQuotes(String key) {
        if (key.length() >= 2 && (key.startsWith("\"") && key.endsWith("\"")
                || key.startsWith("'") && key.endsWith("'"))) {
            return key.substring(1, key.length() - 1);
        }
        return key;
    }
}
