package com.aejis.processor.support;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * File signatures. Only byte comparisons at fixed offsets; nothing here parses content.
 */
public final class MagicBytes {

    /**
     * A byte pattern expected at a fixed offset.
     */
    public record Signature(int offset, byte[] bytes) {

        public static Signature of(int... values) {
            return at(0, values);
        }

        public static Signature at(int offset, int... values) {
            byte[] b = new byte[values.length];
            for (int i = 0; i < values.length; i++) {
                b[i] = (byte) values[i];
            }
            return new Signature(offset, b);
        }

        public static Signature ascii(int offset, String text) {
            return new Signature(offset, text.getBytes(StandardCharsets.ISO_8859_1));
        }

        public boolean matches(byte[] header) {
            if (header == null || header.length < offset + bytes.length) {
                return false;
            }
            for (int i = 0; i < bytes.length; i++) {
                if (header[offset + i] != bytes[i]) {
                    return false;
                }
            }
            return true;
        }
    }

    public static final Signature PNG = Signature.of(0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A);
    public static final Signature JPEG = Signature.of(0xFF, 0xD8, 0xFF);
    public static final Signature GIF87 = Signature.ascii(0, "GIF87a");
    public static final Signature GIF89 = Signature.ascii(0, "GIF89a");
    public static final Signature BMP = Signature.ascii(0, "BM");
    public static final Signature TIFF_LE = Signature.of('I', 'I', 0x2A, 0x00);
    public static final Signature TIFF_BE = Signature.of('M', 'M', 0x00, 0x2A);
    public static final Signature ICO = Signature.of(0x00, 0x00, 0x01, 0x00);
    public static final Signature RIFF = Signature.ascii(0, "RIFF");
    public static final Signature WEBP = Signature.ascii(8, "WEBP");
    public static final Signature WAVE = Signature.ascii(8, "WAVE");
    public static final Signature AVI = Signature.ascii(8, "AVI ");
    public static final Signature FORM = Signature.ascii(0, "FORM");
    public static final Signature AU = Signature.ascii(0, ".snd");
    public static final Signature FTYP = Signature.ascii(4, "ftyp");
    public static final Signature EBML = Signature.of(0x1A, 0x45, 0xDF, 0xA3);
    public static final Signature OGG = Signature.ascii(0, "OggS");
    public static final Signature FLAC = Signature.ascii(0, "fLaC");
    public static final Signature ID3 = Signature.ascii(0, "ID3");
    public static final Signature MPEG_FRAME = Signature.of(0xFF, 0xFB);
    public static final Signature PDF = Signature.ascii(0, "%PDF");
    public static final Signature ZIP = Signature.of('P', 'K', 0x03, 0x04);
    public static final Signature ZIP_EMPTY = Signature.of('P', 'K', 0x05, 0x06);
    public static final Signature OLE2 = Signature.of(0xD0, 0xCF, 0x11, 0xE0, 0xA1, 0xB1, 0x1A, 0xE1);
    public static final Signature GZIP = Signature.of(0x1F, 0x8B);
    public static final Signature SEVEN_Z = Signature.of('7', 'z', 0xBC, 0xAF, 0x27, 0x1C);
    public static final Signature BZIP2 = Signature.ascii(0, "BZh");
    public static final Signature XZ = Signature.of(0xFD, '7', 'z', 'X', 'Z', 0x00);
    public static final Signature RAR = Signature.ascii(0, "Rar!");
    public static final Signature USTAR = Signature.ascii(257, "ustar");
    public static final Signature MZ = Signature.ascii(0, "MZ");
    public static final Signature ELF = Signature.of(0x7F, 'E', 'L', 'F');
    public static final Signature MACHO_32 = Signature.of(0xFE, 0xED, 0xFA, 0xCE);
    public static final Signature MACHO_64 = Signature.of(0xFE, 0xED, 0xFA, 0xCF);
    public static final Signature MACHO_32_LE = Signature.of(0xCE, 0xFA, 0xED, 0xFE);
    public static final Signature MACHO_64_LE = Signature.of(0xCF, 0xFA, 0xED, 0xFE);
    public static final Signature MACHO_FAT = Signature.of(0xCA, 0xFE, 0xBA, 0xBE);
    public static final Signature TRUETYPE = Signature.of(0x00, 0x01, 0x00, 0x00, 0x00);
    public static final Signature OPENTYPE = Signature.ascii(0, "OTTO");
    public static final Signature TRUETYPE_MAC = Signature.ascii(0, "true");
    public static final Signature WOFF = Signature.ascii(0, "wOFF");
    public static final Signature WOFF2 = Signature.ascii(0, "wOF2");
    public static final Signature SQLITE = Signature.ascii(0, "SQLite format 3\0");
    public static final Signature ACCESS = Signature.ascii(4, "Standard Jet DB");
    public static final Signature ACCESS_ACE = Signature.ascii(4, "Standard ACE DB");

    private static final Map<String, Signature[]> NAMED = new LinkedHashMap<>();

    static {
        NAMED.put("png", new Signature[]{PNG});
        NAMED.put("jpeg", new Signature[]{JPEG});
        NAMED.put("gif", new Signature[]{GIF87, GIF89});
        NAMED.put("pdf", new Signature[]{PDF});
        NAMED.put("zip", new Signature[]{ZIP, ZIP_EMPTY});
        NAMED.put("ole2", new Signature[]{OLE2});
        NAMED.put("7z", new Signature[]{SEVEN_Z});
        NAMED.put("gzip", new Signature[]{GZIP});
        NAMED.put("bzip2", new Signature[]{BZIP2});
        NAMED.put("xz", new Signature[]{XZ});
        NAMED.put("rar", new Signature[]{RAR});
        NAMED.put("tar", new Signature[]{USTAR});
        NAMED.put("pe", new Signature[]{MZ});
        NAMED.put("elf", new Signature[]{ELF});
        NAMED.put("macho", new Signature[]{MACHO_32, MACHO_64, MACHO_32_LE, MACHO_64_LE});
        NAMED.put("sqlite", new Signature[]{SQLITE});
        NAMED.put("access", new Signature[]{ACCESS, ACCESS_ACE});
        NAMED.put("woff", new Signature[]{WOFF});
        NAMED.put("woff2", new Signature[]{WOFF2});
        NAMED.put("otf", new Signature[]{OPENTYPE});
        NAMED.put("ttf", new Signature[]{TRUETYPE, TRUETYPE_MAC});
        NAMED.put("flac", new Signature[]{FLAC});
        NAMED.put("ogg", new Signature[]{OGG});
        NAMED.put("mp3", new Signature[]{ID3, MPEG_FRAME});
        NAMED.put("mkv", new Signature[]{EBML});
        NAMED.put("iso-bmff", new Signature[]{FTYP});
        NAMED.put("tiff", new Signature[]{TIFF_LE, TIFF_BE});
        NAMED.put("au", new Signature[]{AU});
        NAMED.put("bmp", new Signature[]{BMP});
    }

    private MagicBytes() {}

    /**
     * Names the format the header identifies, if any. RIFF and IFF containers are
     * resolved to their form type (wav, avi, webp, aiff).
     */
    public static Optional<String> detect(byte[] header) {
        if (RIFF.matches(header)) {
            if (WAVE.matches(header)) return Optional.of("wav");
            if (AVI.matches(header)) return Optional.of("avi");
            if (WEBP.matches(header)) return Optional.of("webp");
            return Optional.of("riff");
        }
        if (FORM.matches(header)) {
            return Optional.of("aiff");
        }
        for (var entry : NAMED.entrySet()) {
            for (Signature signature : entry.getValue()) {
                if (signature.matches(header)) {
                    return Optional.of(entry.getKey());
                }
            }
        }
        return Optional.empty();
    }

    public static boolean isExecutable(byte[] header) {
        return MZ.matches(header) || ELF.matches(header) || MACHO_32.matches(header)
                || MACHO_64.matches(header) || MACHO_32_LE.matches(header) || MACHO_64_LE.matches(header);
    }
}
