package com.williamcallahan.docarchive.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class DocumentTest {

    private static Document document() {
        Document document = new Document("Invoice", "application/pdf", "c1");
        document.setCreated(Instant.parse("2020-12-31T23:30:00Z"));
        return document;
    }

    @Test
    void displayNameIncludesCorrespondentWhenSet() {
        Document document = document();
        document.setCorrespondent(new Correspondent("ACME"));

        assertEquals("2020-12-31 ACME Invoice", document.toString());
    }

    @Test
    void displayNameSkipsEmptyTitle() {
        Document document = document();
        document.setTitle("");

        assertEquals("2020-12-31", document.toString());
    }

    @Test
    void displayDateUsesRequestedZone() {
        assertEquals("2021-01-01 Invoice", document().displayName(ZoneId.of("Europe/Berlin")));
    }

    @Test
    void archiveVersionFollowsArchiveFilename() {
        Document document = document();
        assertFalse(document.hasArchiveVersion());

        document.setArchiveFilename("invoice.pdf");
        assertTrue(document.hasArchiveVersion());
    }

    @Test
    void matchingEntitiesHaveSensibleDefaults() {
        Tag tag = new Tag("inbox");

        assertEquals(Tag.DEFAULT_COLOR, tag.getColor());
        assertEquals(MatchingAlgorithm.ANY, tag.getMatchingAlgorithm());
        assertTrue(tag.isInsensitive());
        assertEquals("inbox", tag.toString());
    }
}
