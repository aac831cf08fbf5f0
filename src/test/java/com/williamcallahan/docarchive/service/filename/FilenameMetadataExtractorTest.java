package com.williamcallahan.docarchive.service.filename;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.docarchive.config.AppProperties;
import com.williamcallahan.docarchive.domain.filename.FilenameParseTransform;
import com.williamcallahan.docarchive.domain.filename.ParsedFilename;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Verifies creation date and title recovery from uploaded filenames.
 */
class FilenameMetadataExtractorTest {

    private final FilenameMetadataExtractor extractor = new FilenameMetadataExtractor(List.of());

    @Test
    void parsesFullTimestampAndTitle() {
        ParsedFilename parsed = extractor.extract("20200102123456Z - Electricity bill.pdf");

        assertEquals(Instant.parse("2020-01-02T12:34:56Z"), parsed.created());
        assertEquals("Electricity bill", parsed.title());
    }

    @Test
    void dateOnlyPrefixIsMidnightUtc() {
        ParsedFilename parsed = extractor.extract("20200102 - Bill.pdf");

        assertEquals(Instant.parse("2020-01-02T00:00:00Z"), parsed.created());
        assertEquals("Bill", parsed.title());
    }

    @Test
    void timestampSuffixIsCaseInsensitive() {
        ParsedFilename parsed = extractor.extract("20200102z - Bill.pdf");

        assertEquals(Instant.parse("2020-01-02T00:00:00Z"), parsed.created());
    }

    @Test
    void plainNameBecomesTitleWithoutDate() {
        ParsedFilename parsed = extractor.extract("Tax return 2019.pdf");

        assertNull(parsed.created());
        assertEquals("Tax return 2019", parsed.title());
    }

    @Test
    void onlyTheLastExtensionIsRemoved() {
        assertEquals("backup.tar", extractor.extract("backup.tar.gz").title());
    }

    @Test
    void nameWithoutExtensionIsKept() {
        assertEquals("README", extractor.extract("README").title());
    }

    @Test
    void bareExtensionYieldsEmptyTitle() {
        ParsedFilename parsed = extractor.extract(".pdf");

        assertEquals("", parsed.title());
        assertNull(parsed.created());
    }

    @Test
    void impossibleDateKeepsTitleButDropsDate() {
        ParsedFilename parsed = extractor.extract("20201345 - Bad date.pdf");

        assertNull(parsed.created());
        assertEquals("Bad date", parsed.title());
    }

    @Test
    void yearZeroDropsDate() {
        ParsedFilename parsed = extractor.extract("00000101000000Z - Old.pdf");

        assertNull(parsed.created());
        assertEquals("Old", parsed.title());
    }

    @Test
    void yearOneIsAccepted() {
        assertEquals(Instant.parse("0001-01-01T00:00:00Z"), extractor.extract("00010101 - Old.pdf").created());
    }

    @Test
    void digitsWithoutSeparatorAreTreatedAsTitle() {
        ParsedFilename parsed = extractor.extract("20200102.pdf");

        assertNull(parsed.created());
        assertEquals("20200102", parsed.title());
    }

    @Test
    void firstMatchingTransformRewritesTheName() {
        FilenameMetadataExtractor withTransforms = new FilenameMetadataExtractor(List.of(
                FilenameParseTransform.compile("^scan_(\\d{8})_(.*)$", "$1 - $2"),
                FilenameParseTransform.compile("^scan_(.*)$", "never used $1")));

        ParsedFilename parsed = withTransforms.extract("scan_20210304_Invoice.pdf");

        assertEquals(Instant.parse("2021-03-04T00:00:00Z"), parsed.created());
        assertEquals("Invoice", parsed.title());
    }

    @Test
    void nonMatchingTransformsLeaveTheNameAlone() {
        FilenameMetadataExtractor withTransforms = new FilenameMetadataExtractor(List.of(
                FilenameParseTransform.compile("^fax_(.*)$", "$1")));

        assertEquals("scan_Invoice", withTransforms.extract("scan_Invoice.pdf").title());
    }

    @Test
    void transformsAreReadFromAppProperties() {
        AppProperties appProperties = new AppProperties();
        appProperties.getFilename().getParseTransforms()
                .add(new AppProperties.ParseTransform("^(\\d{4})-(\\d{2})-(\\d{2}) (.*)$", "$1$2$3 - $4"));

        ParsedFilename parsed = new FilenameMetadataExtractor(appProperties).extract("2022-05-06 Lease.pdf");

        assertEquals(Instant.parse("2022-05-06T00:00:00Z"), parsed.created());
        assertEquals("Lease", parsed.title());
    }

    @Test
    void rejectsNullFilename() {
        assertThrows(NullPointerException.class, () -> extractor.extract(null));
    }

    @Test
    void splitExtensionTreatsLeadingDotsAsPartOfTheName() {
        assertEquals(".bashrc", FilenameMetadataExtractor.splitExtension(".bashrc"));
        assertEquals("dir.v2/file", FilenameMetadataExtractor.splitExtension("dir.v2/file.txt"));
        assertEquals("dir.v2/file", FilenameMetadataExtractor.splitExtension("dir.v2/file"));
    }
}
