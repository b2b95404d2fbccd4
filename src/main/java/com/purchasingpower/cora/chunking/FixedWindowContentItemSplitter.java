package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.configuration.AppProperties;
import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.util.TextLines;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Last-resort splitter: consecutive windows of {@code app.chunking.window-lines} lines.
 * Accepts every language and never returns an empty list for non-empty text.
 */
@Component
@RequiredArgsConstructor
public class FixedWindowContentItemSplitter implements ContentItemSplitter {

    private final AppProperties appProperties;

    @Override
    public boolean supports(Language language) {
        return true;
    }

    @Override
    public List<ContentItem> split(TextLines lines, Language language) {
        int window = Math.max(1, appProperties.getChunking().getWindowLines());
        List<ContentItem> items = new ArrayList<>();
        for (int start = 1; start <= lines.count(); start += window) {
            int end = Math.min(lines.count(), start + window - 1);
            items.add(ContentItem.heuristic(null, null, start, end));
        }
        return items;
    }
}
