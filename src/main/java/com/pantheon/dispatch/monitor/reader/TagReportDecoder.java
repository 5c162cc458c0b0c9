package com.pantheon.dispatch.monitor.reader;

import com.pantheon.dispatch.monitor.tagdb.TagDatabase;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * TagReportDecoder
 * -----------------------------------------------------------------------------
 * Decodes the text tag reports sent by the reader gateway.
 *
 * <p>A report is UTF-8 text listing EPC identifiers in hexadecimal, separated
 * by whitespace, commas or semicolons. Identifiers are reported in the tag
 * database's canonical form. Tokens that
 * are not hexadecimal are dropped. A report without a single valid identifier
 * decodes to empty.</p>
 */
public final class TagReportDecoder
{
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,;]+");
    private static final Pattern EPC = Pattern.compile("[0-9A-F]+");

    public Optional<Set<String>> decode(byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);

        Set<String> tagIds = new LinkedHashSet<>();
        for (String token : SEPARATORS.split(text.trim())) {
            String candidate = TagDatabase.canonicalTagId(token);
            if (EPC.matcher(candidate).matches()) {
                tagIds.add(candidate);
            }
        }

        return tagIds.isEmpty() ? Optional.empty() : Optional.of(Set.copyOf(tagIds));
    }
}
