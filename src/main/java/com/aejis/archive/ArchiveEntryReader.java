package com.aejis.archive;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * Walks the entry table of one archive format. Adding a format means adding a reader;
 * the limit checks in {@link ArchiveSafetyExtractor} stay untouched.
 */
public interface ArchiveEntryReader {

    /** Short format name, e.g. "zip", "tar.gz". */
    String format();

    /**
     * @param name   lower-case file name, used for formats without a reliable signature
     * @param header the first bytes of the data
     */
    boolean supports(String name, byte[] header);

    EntryCursor open(byte[] data) throws IOException;

    /**
     * Opens the archive under {@code limits}. Readers whose decoders can be told to refuse
     * oversized allocations up front override this; the others leave enforcement to the
     * extractor's byte counting.
     */
    default EntryCursor open(byte[] data, ArchiveLimits limits) throws IOException {
        return open(data);
    }

    /**
     * Forward-only iteration over entries. {@link #stream()} reads the current entry and
     * is only valid until the next call to {@link #next()}.
     */
    interface EntryCursor extends Closeable {

        /** @return the next entry, or {@code null} at the end of the archive */
        EntryInfo next() throws IOException;

        InputStream stream() throws IOException;
    }

    /**
     * @param name         entry name as stored in the archive, unsanitized
     * @param declaredSize uncompressed size from the entry table, -1 if unknown
     * @param directory    whether the entry is a directory
     */
    record EntryInfo(String name, long declaredSize, boolean directory) {}

    static boolean startsWith(byte[] header, int... signature) {
        if (header == null || header.length < signature.length) {
            return false;
        }
        for (int i = 0; i < signature.length; i++) {
            if ((header[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
