package com.aejis.archive;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.apache.commons.compress.compressors.xz.XZCompressorInputStream;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Plain and compressed tarballs.
 */
public class TarEntryReader implements ArchiveEntryReader {

    public enum Compression {
        NONE("tar"),
        GZIP("tar.gz"),
        BZIP2("tar.bz2"),
        XZ("tar.xz");

        private final String format;

        Compression(String format) {
            this.format = format;
        }
    }

    private final Compression compression;

    public TarEntryReader(Compression compression) {
        this.compression = compression;
    }

    @Override
    public String format() {
        return compression.format;
    }

    @Override
    public boolean supports(String name, byte[] header) {
        return switch (compression) {
            case NONE -> isUstar(header) || name.endsWith(".tar");
            case GZIP -> ArchiveEntryReader.startsWith(header, 0x1F, 0x8B)
                    && (name.endsWith(".tar.gz") || name.endsWith(".tgz"));
            case BZIP2 -> ArchiveEntryReader.startsWith(header, 'B', 'Z', 'h')
                    && (name.endsWith(".tar.bz2") || name.endsWith(".tbz2"));
            case XZ -> ArchiveEntryReader.startsWith(header, 0xFD, '7', 'z', 'X', 'Z', 0x00)
                    && (name.endsWith(".tar.xz") || name.endsWith(".txz"));
        };
    }

    private static boolean isUstar(byte[] header) {
        return header != null && header.length >= 262
                && header[257] == 'u' && header[258] == 's' && header[259] == 't'
                && header[260] == 'a' && header[261] == 'r';
    }

    @Override
    public EntryCursor open(byte[] data) throws IOException {
        InputStream raw = new ByteArrayInputStream(data);
        InputStream decompressed = switch (compression) {
            case NONE -> raw;
            case GZIP -> new GzipCompressorInputStream(raw, true);
            case BZIP2 -> new BZip2CompressorInputStream(raw, true);
            case XZ -> new XZCompressorInputStream(raw, true);
        };
        var tar = new TarArchiveInputStream(decompressed);
        return new EntryCursor() {
            @Override
            public EntryInfo next() throws IOException {
                TarArchiveEntry entry = tar.getNextEntry();
                if (entry == null) {
                    return null;
                }
                return new EntryInfo(entry.getName(), entry.getSize(), entry.isDirectory());
            }

            @Override
            public InputStream stream() {
                return tar;
            }

            @Override
            public void close() throws IOException {
                tar.close();
            }
        };
    }
}
