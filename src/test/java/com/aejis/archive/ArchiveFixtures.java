package com.aejis.archive;

import org.apache.commons.compress.archivers.sevenz.SevenZArchiveEntry;
import org.apache.commons.compress.archivers.sevenz.SevenZMethod;
import org.apache.commons.compress.archivers.sevenz.SevenZOutputFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.utils.SeekableInMemoryByteChannel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small archives in memory for extractor and processor tests.
 */
public final class ArchiveFixtures {

    private ArchiveFixtures() {}

    public static Map<String, byte[]> entries(Object... nameAndContent) {
        var map = new LinkedHashMap<String, byte[]>();
        for (int i = 0; i < nameAndContent.length; i += 2) {
            Object content = nameAndContent[i + 1];
            map.put((String) nameAndContent[i],
                    content instanceof byte[] b ? b : content.toString().getBytes());
        }
        return map;
    }

    public static byte[] zip(Map<String, byte[]> entries) {
        var bytes = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(bytes)) {
            for (var e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /** {@code count} empty entries named {@code f<n>.txt}. */
    public static byte[] zipOfEmptyEntries(int count) {
        var bytes = new ByteArrayOutputStream();
        try (var zip = new ZipOutputStream(bytes)) {
            for (int i = 0; i < count; i++) {
                zip.putNextEntry(new ZipEntry("f" + i + ".txt"));
                zip.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    /** A zip containing a zip containing ... {@code levels} deep, innermost holding one text file. */
    public static byte[] nestedZip(int levels) {
        byte[] current = zip(entries("payload.txt", "deepest"));
        for (int level = 1; level < levels; level++) {
            current = zip(entries("level" + level + ".zip", current));
        }
        return current;
    }

    /** LZMA2-compressed 7z with the coder's default 8 MiB dictionary. */
    public static byte[] sevenZ(Map<String, byte[]> entries) {
        var channel = new SeekableInMemoryByteChannel();
        try (var sevenZ = new SevenZOutputFile(channel)) {
            sevenZ.setContentCompression(SevenZMethod.LZMA2);
            for (var e : entries.entrySet()) {
                var entry = new SevenZArchiveEntry();
                entry.setName(e.getKey());
                sevenZ.putArchiveEntry(entry);
                sevenZ.write(e.getValue());
                sevenZ.closeArchiveEntry();
            }
            sevenZ.finish();
            return Arrays.copyOf(channel.array(), (int) channel.size());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static byte[] tar(Map<String, byte[]> entries) {
        var bytes = new ByteArrayOutputStream();
        writeTar(bytes, entries);
        return bytes.toByteArray();
    }

    public static byte[] tarGz(Map<String, byte[]> entries) {
        var bytes = new ByteArrayOutputStream();
        try (var gz = new GzipCompressorOutputStream(bytes)) {
            writeTar(gz, entries);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    private static void writeTar(OutputStream target, Map<String, byte[]> entries) {
        try {
            var tar = new TarArchiveOutputStream(target);
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            for (var e : entries.entrySet()) {
                var entry = new TarArchiveEntry(e.getKey());
                entry.setSize(e.getValue().length);
                tar.putArchiveEntry(entry);
                tar.write(e.getValue());
                tar.closeArchiveEntry();
            }
            tar.finish();
            tar.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
