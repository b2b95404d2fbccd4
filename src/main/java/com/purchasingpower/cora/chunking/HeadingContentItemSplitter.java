package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.index.EntityType;
import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.FormatFamily;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.util.TextLines;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits Markdown at ATX headings. Each heading opens a section that runs up to the next
 * heading; headings inside fenced code blocks are ignored.
 */
@Component
public class HeadingContentItemSplitter implements ContentItemSplitter {

    private static final Pattern HEADING = Pattern.compile("^ {0,3}(#{1,6})\\s+(.+?)\\s*#*\\s*$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(```|~~~)");

    @Override
    public boolean supports(Language language) {
        return language.getFamily() == FormatFamily.MARKDOWN;
    }

    @Override
    public List<ContentItem> split(TextLines lines, Language language) {
        List<Integer> headingLines = new ArrayList<>();
        List<String> titles = new ArrayList<>();
        boolean inFence = false;

        for (int n = 1; n <= lines.count(); n++) {
            String line = lines.line(n);
            if (FENCE.matcher(line).find()) {
                inFence = !inFence;
                continue;
            }
            if (inFence) {
                continue;
            }
            Matcher heading = HEADING.matcher(line);
            if (heading.matches()) {
                headingLines.add(n);
                titles.add(heading.group(2));
            }
        }

        List<ContentItem> items = new ArrayList<>(headingLines.size());
        for (int i = 0; i < headingLines.size(); i++) {
            int start = headingLines.get(i);
            int end = i + 1 < headingLines.size() ? headingLines.get(i + 1) - 1 : lines.count();
            items.add(ContentItem.heuristic(titles.get(i), EntityType.SECTION, start, end));
        }
        return items;
    }

    /** GitHub-style anchor slug of a heading title. */
    public static String slug(String title) {
        return title.trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^\\p{L}\\p{N}\\s_-]", "")
                .replaceAll("\\s", "-");
    }
}
