package com.pantheon.dispatch.monitor.tagdb;

import java.util.Objects;

/**
 * What is known about one tagged item.
 *
 * @param tagId       EPC identifier written to the tag
 * @param productCode product the tagged item belongs to, as used on shipment manifests
 * @param description free-text description; may be {@code null}
 */
public record TagDocument(String tagId, String productCode, String description)
{
    public TagDocument {
        Objects.requireNonNull(tagId, "tagId");
        Objects.requireNonNull(productCode, "productCode");
    }
}
