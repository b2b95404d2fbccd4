package com.purchasingpower.cora.knowledge;

import com.purchasingpower.cora.chunking.ChunkedFile;
import com.purchasingpower.cora.model.index.FileVersion;

/**
 * Extracts definition and reference records from a chunked file.
 *
 * <p>Works on one file at a time and never looks at other files: resolving a reference to its
 * definition is done at query time by {@link ReferenceResolver}. Grammar-parsed files use the
 * syntax tree; everything else uses line patterns (Markdown headings and links, configuration
 * keys, declaration keywords and call sites in unparsed code).
 *
 * <p>Every non-empty file also gets a {@code MODULE} definition named after the file, so that
 * imports and links naming a file resolve to it.
 */
public interface ReferenceExtractor {

    ExtractedEntities extract(FileVersion fileVersion, ChunkedFile chunkedFile);
}
