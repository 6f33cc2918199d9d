package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;
import com.aejis.processor.support.Thumbnails;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Raster images. Dimensions come from the image header before any pixels are decoded,
 * so oversized images are refused without allocating them.
 */
public class ImageProcessor implements Processor {

    static final long MAX_PIXELS = 50_000_000L;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".png", ".jpg", ".jpeg", ".jpe", ".gif", ".bmp", ".webp", ".tif", ".tiff", ".ico"),
            Set.of("image/png", "image/jpeg", "image/gif", "image/bmp", "image/webp", "image/tiff",
                    "image/x-icon", "image/vnd.microsoft.icon"),
            List.of(MagicBytes.PNG, MagicBytes.JPEG, MagicBytes.GIF87, MagicBytes.GIF89, MagicBytes.BMP,
                    MagicBytes.TIFF_LE, MagicBytes.TIFF_BE, MagicBytes.WEBP));

    @Override
    public String id() {
        return "image";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException {
        var result = ProcessingResult.builder("image");
        byte[] data = artifact.data();
        result.metadata("size", data.length);

        if (MagicBytes.RIFF.matches(data) && MagicBytes.WEBP.matches(data)) {
            return describeWebp(data, result);
        }
        if (".ico".equals(artifact.extension()) && MagicBytes.ICO.matches(data)) {
            return describeIco(data, result);
        }

        try (ImageInputStream iis = ImageIO.createImageInputStream(new ByteArrayInputStream(data))) {
            Iterator<ImageReader> readers = iis != null ? ImageIO.getImageReaders(iis) : null;
            if (readers == null || !readers.hasNext()) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "no decoder recognizes the image data");
                return result.error("Unrecognized image format", "UNSUPPORTED_FORMAT").build();
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                int width = reader.getWidth(0);
                int height = reader.getHeight(0);
                String format = reader.getFormatName().toUpperCase(Locale.ROOT);
                result.metadata("format", format)
                        .metadata("width", width)
                        .metadata("height", height)
                        .metadata("dimensions", width + "x" + height);

                if ((long) width * height > MAX_PIXELS) {
                    Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                            "declared dimensions " + width + "x" + height + " exceed decode limit");
                    return result.content("Image " + width + "x" + height + " " + format + " (not decoded)").build();
                }

                BufferedImage image = reader.read(0);
                result.metadata("color_model", describeColorModel(image))
                        .metadata("has_alpha", image.getColorModel().hasAlpha())
                        .metadata("bits_per_pixel", image.getColorModel().getPixelSize())
                        .thumbnail(Thumbnails.pngDataUri(image))
                        .content("Image " + width + "x" + height + " " + format);
            } finally {
                reader.dispose();
            }
        }

        checkTrailingData(data, result);
        result.log("Decoded image header and rendered thumbnail");
        return result.build();
    }

    private void checkTrailingData(byte[] data, ProcessingResult.Builder result) {
        long end = -1;
        try {
            if (MagicBytes.PNG.matches(data)) {
                end = pngEnd(new ByteReader(data));
            } else if (MagicBytes.JPEG.matches(data)) {
                end = jpegEnd(data);
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed image structure: " + e.getMessage());
            return;
        }
        if (end < 0 || end >= data.length) {
            return;
        }
        long trailing = data.length - end;
        result.metadata("trailing_bytes", trailing);
        byte[] tail = Arrays.copyOfRange(data, (int) end, data.length);
        if (MagicBytes.ZIP.matches(tail) || MagicBytes.RAR.matches(tail) || MagicBytes.SEVEN_Z.matches(tail)) {
            Findings.report(result, SignalCategory.ARCHIVE_RISK, "archive appended after image data");
        } else if (MagicBytes.isExecutable(tail)) {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, "executable appended after image data");
        } else {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, trailing + " bytes appended after image data");
        }
    }

    /** Offset just past the IEND chunk, -1 if there is none. */
    static long pngEnd(ByteReader reader) {
        long offset = 8;
        int chunks = 0;
        while (reader.has(offset, 8) && chunks++ < 100_000) {
            long length = reader.u32be(offset);
            String type = reader.ascii(offset + 4, 4);
            long next = offset + 12 + length;
            if ("IEND".equals(type)) {
                return next;
            }
            offset = next;
        }
        return -1;
    }

    /** Offset just past the last end-of-image marker, -1 if there is none. */
    static long jpegEnd(byte[] data) {
        for (int i = data.length - 2; i >= 2; i--) {
            if ((data[i] & 0xFF) == 0xFF && (data[i + 1] & 0xFF) == 0xD9) {
                return i + 2;
            }
        }
        return -1;
    }

    private ProcessingResult describeWebp(byte[] data, ProcessingResult.Builder result) {
        var reader = new ByteReader(data);
        result.metadata("format", "WEBP");
        try {
            String chunk = reader.ascii(12, 4);
            int width;
            int height;
            switch (chunk) {
                case "VP8X" -> {
                    width = 1 + (reader.u8(24) | reader.u8(25) << 8 | reader.u8(26) << 16);
                    height = 1 + (reader.u8(27) | reader.u8(28) << 8 | reader.u8(29) << 16);
                }
                case "VP8L" -> {
                    long bits = reader.u32le(21);
                    width = (int) (bits & 0x3FFF) + 1;
                    height = (int) ((bits >> 14) & 0x3FFF) + 1;
                }
                case "VP8 " -> {
                    width = reader.u16le(26) & 0x3FFF;
                    height = reader.u16le(28) & 0x3FFF;
                }
                default -> throw new MalformedStructureException("unknown WebP chunk " + chunk);
            }
            long riffSize = reader.u32le(4) + 8;
            if (riffSize < data.length) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                        (data.length - riffSize) + " bytes appended after image data");
            }
            result.metadata("width", width).metadata("height", height)
                    .metadata("dimensions", width + "x" + height)
                    .content("Image " + width + "x" + height + " WEBP (no thumbnail decoder)");
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed WebP header");
        }
        return result.build();
    }

    private ProcessingResult describeIco(byte[] data, ProcessingResult.Builder result) {
        var reader = new ByteReader(data);
        result.metadata("format", "ICO");
        try {
            int count = reader.u16le(4);
            int width = reader.u8(6) == 0 ? 256 : reader.u8(6);
            int height = reader.u8(7) == 0 ? 256 : reader.u8(7);
            long imageOffset = reader.u32le(18);
            result.metadata("image_count", count)
                    .metadata("width", width).metadata("height", height)
                    .metadata("dimensions", width + "x" + height)
                    .content("Icon with " + count + " image(s), first " + width + "x" + height);
            if (imageOffset >= data.length) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "icon image offset outside file");
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed icon directory");
        }
        return result.build();
    }

    private static String describeColorModel(BufferedImage image) {
        int components = image.getColorModel().getNumComponents();
        boolean alpha = image.getColorModel().hasAlpha();
        return switch (components) {
            case 1 -> "GRAY";
            case 2 -> "GRAY_ALPHA";
            case 3 -> "RGB";
            case 4 -> alpha ? "RGBA" : "CMYK";
            default -> components + "-component";
        };
    }
}
