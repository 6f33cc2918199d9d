package com.aejis.archive;

import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Streams local file headers, so entry counts are checked as the archive is read rather
 * than after the central directory has been loaded.
 */
public class ZipEntryReader implements ArchiveEntryReader {

    @Override
    public String format() {
        return "zip";
    }

    @Override
    public boolean supports(String name, byte[] header) {
        return ArchiveEntryReader.startsWith(header, 0x50, 0x4B, 0x03, 0x04)
                || ArchiveEntryReader.startsWith(header, 0x50, 0x4B, 0x05, 0x06);
    }

    @Override
    public EntryCursor open(byte[] data) {
        var zip = new ZipArchiveInputStream(new ByteArrayInputStream(data), "UTF-8", true, true);
        return new EntryCursor() {
            @Override
            public EntryInfo next() throws IOException {
                ZipArchiveEntry entry = zip.getNextEntry();
                if (entry == null) {
                    return null;
                }
                return new EntryInfo(entry.getName(), entry.getSize(), entry.isDirectory());
            }

            @Override
            public InputStream stream() {
                return zip;
            }

            @Override
            public void close() throws IOException {
                zip.close();
            }
        };
    }
}
