package com.aejis.archive;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * A lone gzip stream, exposed as an archive with a single entry. The uncompressed size
 * in the gzip trailer is not trusted, so the entry's size is reported as unknown.
 */
public class GzipEntryReader implements ArchiveEntryReader {

    static final String SINGLE_ENTRY_NAME = "content";

    @Override
    public String format() {
        return "gz";
    }

    @Override
    public boolean supports(String name, byte[] header) {
        return ArchiveEntryReader.startsWith(header, 0x1F, 0x8B);
    }

    @Override
    public EntryCursor open(byte[] data) throws IOException {
        var gzip = new GzipCompressorInputStream(new ByteArrayInputStream(data), true);
        return new EntryCursor() {
            private boolean consumed;

            @Override
            public EntryInfo next() {
                if (consumed) {
                    return null;
                }
                consumed = true;
                return new EntryInfo(SINGLE_ENTRY_NAME, -1, false);
            }

            @Override
            public InputStream stream() {
                return gzip;
            }

            @Override
            public void close() throws IOException {
                gzip.close();
            }
        };
    }
}
