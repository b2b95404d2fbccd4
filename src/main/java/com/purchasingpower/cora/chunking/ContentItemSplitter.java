package com.purchasingpower.cora.chunking;

import com.purchasingpower.cora.model.parse.ContentItem;
import com.purchasingpower.cora.model.parse.Language;
import com.purchasingpower.cora.util.TextLines;

import java.util.List;

/**
 * Produces content items with line spans from raw text, without a grammar.
 *
 * One implementation exists per format family. Items are returned in line order and must not
 * overlap; lines between items are allowed and are attached to neighbouring chunks later.
 */
public interface ContentItemSplitter {

    boolean supports(Language language);

    /**
     * @return items in line order; an empty list means the splitter found no structure
     */
    List<ContentItem> split(TextLines lines, Language language);
}
