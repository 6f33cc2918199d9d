package com.aejis.archive;

import org.apache.commons.compress.MemoryLimitException;
import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZFile;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.IOException;
import java.io.InputStream;

/**
 * 7z archives. LZMA/LZMA2 coders come from the org.tukaani xz library.
 *
 * <p>The dictionary a 7z coder asks for is allocated before a single byte is decoded, so
 * it is capped separately: at the total extraction budget, and never above
 * {@link #MAX_DECODER_MEMORY_KB}.
 */
public class SevenZEntryReader implements ArchiveEntryReader {

    static final int MAX_DECODER_MEMORY_KB = 64 * 1024;

    @Override
    public String format() {
        return "7z";
    }

    @Override
    public boolean supports(String name, byte[] header) {
        return ArchiveEntryReader.startsWith(header, '7', 'z', 0xBC, 0xAF, 0x27, 0x1C);
    }

    @Override
    public EntryCursor open(byte[] data) throws IOException {
        return open(data, ArchiveLimits.defaults());
    }

    @Override
    public EntryCursor open(byte[] data, ArchiveLimits limits) throws IOException {
        int memoryLimitKb = decoderMemoryLimitKb(limits);
        SevenZFile sevenZ;
        try {
            sevenZ = SevenZFile.builder()
                    .setSeekableByteChannel(new SeekableInMemoryByteChannel(data))
                    .setMaxMemoryLimitKb(memoryLimitKb)
                    .get();
        } catch (MemoryLimitException e) {
            throw overLimit(e, "(archive header)");
        }
        return new EntryCursor() {
            private SevenZArchiveEntry current;

            @Override
            public EntryInfo next() throws IOException {
                try {
                    current = sevenZ.getNextEntry();
                } catch (MemoryLimitException e) {
                    throw overLimit(e, "(next entry)");
                }
                if (current == null) {
                    return null;
                }
                long size = current.hasStream() ? current.getSize() : 0;
                return new EntryInfo(current.getName(), size, current.isDirectory());
            }

            @Override
            public InputStream stream() throws IOException {
                if (current == null || !current.hasStream()) {
                    return InputStream.nullInputStream();
                }
                try {
                    return sevenZ.getInputStream(current);
                } catch (MemoryLimitException e) {
                    throw overLimit(e, current.getName());
                }
            }

            @Override
            public void close() throws IOException {
                sevenZ.close();
            }
        };
    }

    static int decoderMemoryLimitKb(ArchiveLimits limits) {
        long kb = Math.max(1, limits.maxTotalSize() / 1024);
        return (int) Math.min(kb, MAX_DECODER_MEMORY_KB);
    }

    private static ArchiveLimitExceededException overLimit(MemoryLimitException e, String entryName) {
        return new ArchiveLimitExceededException(ArchiveLimitExceededException.Limit.DECODER_MEMORY,
                e.getMemoryLimitInKb() * 1024L, e.getMemoryNeededInKb() * 1024L, entryName);
    }
}
