package com.kura.search.client;

import com.kura.search.model.ContentAttributes;
import com.kura.search.model.ContentMetadata;

import java.util.Collection;
import java.util.List;

public interface MetadataStore {

    /**
     * Filter view (owner, type, tags, creation time) for candidate ranking.
     * Unknown ids are omitted from the result.
     */
    List<ContentAttributes> findAttributes(Collection<String> ids);

    /**
     * Full display records, fetched only for the ids that make the final page.
     */
    List<ContentMetadata> findByIds(Collection<String> ids);
}
