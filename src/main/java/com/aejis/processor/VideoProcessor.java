package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.IsoBmff;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;

import java.util.List;
import java.util.Set;

/**
 * Container-level metadata for MP4/MOV, AVI and Matroska/WebM. Frames are never decoded.
 */
public class VideoProcessor implements Processor {

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".mp4", ".m4v", ".mov", ".3gp", ".avi", ".mkv", ".webm"),
            Set.of("video/*"),
            List.of(MagicBytes.FTYP, MagicBytes.AVI, MagicBytes.EBML));

    private static final int EBML_DOCTYPE = 0x4282;
    private static final int MATROSKA_DURATION = 0x4489;
    private static final int MATROSKA_TIMECODE_SCALE = 0x2AD7B1;

    @Override
    public String id() {
        return "video";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("video");
        byte[] data = artifact.data();
        result.metadata("size", data.length);
        try {
            if (MagicBytes.FTYP.matches(data)) {
                describeIsoMedia(data, result);
            } else if (MagicBytes.RIFF.matches(data) && MagicBytes.AVI.matches(data)) {
                describeAvi(new ByteReader(data), result);
            } else if (MagicBytes.EBML.matches(data)) {
                describeMatroska(data, result);
            } else {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                        "no video container signature for " + artifact.extension());
                result.content("Unrecognized video container");
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed container: " + e.getMessage());
            result.content("Malformed video container");
        }
        return result.build();
    }

    private void describeIsoMedia(byte[] data, ProcessingResult.Builder result) {
        IsoBmff.Summary summary = IsoBmff.parse(data);
        result.metadata("format", "iso-bmff").metadata(summary.asMetadata());
        if (summary.trailingBytes() > 0) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                    summary.trailingBytes() + " bytes after the last box");
        }
        var content = new StringBuilder("Video: ").append(summary.majorBrand());
        if (summary.durationSeconds() != null) {
            content.append(", ").append(summary.durationSeconds()).append(" s");
        }
        if (summary.width() != null) {
            content.append(", ").append(summary.width()).append('x').append(summary.height());
        }
        result.content(content.toString());
    }

    private void describeAvi(ByteReader reader, ProcessingResult.Builder result) {
        long avih = indexOf(reader, "avih", 4096);
        result.metadata("format", "avi");
        if (avih < 0) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "AVI without main header");
            result.content("Video: avi (no main header)");
            return;
        }
        long base = avih + 8;
        long microsPerFrame = reader.u32le(base);
        long totalFrames = reader.u32le(base + 16);
        long streams = reader.u32le(base + 24);
        long width = reader.u32le(base + 32);
        long height = reader.u32le(base + 36);
        double seconds = Math.round(totalFrames * microsPerFrame / 1000.0) / 1000.0;
        result.metadata("frames", totalFrames)
                .metadata("streams", streams)
                .metadata("duration_seconds", seconds)
                .metadata("width", width)
                .metadata("height", height)
                .metadata("dimensions", width + "x" + height)
                .content("Video: avi, " + seconds + " s, " + width + "x" + height);
        long riffEnd = reader.u32le(4) + 8;
        if (riffEnd < reader.length()) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                    (reader.length() - riffEnd) + " bytes after the RIFF chunk");
        }
    }

    private void describeMatroska(byte[] data, ProcessingResult.Builder result) {
        var reader = new ByteReader(data);
        int window = Math.min(data.length, 64 * 1024);
        String docType = null;
        long docTypeAt = indexOfId(data, EBML_DOCTYPE, 2, window);
        if (docTypeAt >= 0) {
            int[] size = vint(reader, docTypeAt + 2);
            docType = reader.ascii(docTypeAt + 2 + size[1], Math.min(size[0], 32)).trim();
        }
        long scale = 1_000_000L;
        long scaleAt = indexOfId(data, MATROSKA_TIMECODE_SCALE, 3, window);
        if (scaleAt >= 0) {
            int[] size = vint(reader, scaleAt + 3);
            scale = readUnsigned(reader, scaleAt + 3 + size[1], size[0]);
        }
        result.metadata("format", docType != null ? docType : "matroska");
        long durationAt = indexOfId(data, MATROSKA_DURATION, 2, window);
        var content = new StringBuilder("Video: ").append(docType != null ? docType : "matroska");
        if (durationAt >= 0) {
            int[] size = vint(reader, durationAt + 2);
            long at = durationAt + 2 + size[1];
            double ticks = size[0] == 4
                    ? Float.intBitsToFloat((int) reader.u32be(at))
                    : Double.longBitsToDouble(reader.u64be(at));
            double seconds = Math.round(ticks * scale / 1_000_000.0) / 1000.0;
            result.metadata("duration_seconds", seconds);
            content.append(", ").append(seconds).append(" s");
        }
        result.content(content.toString());
    }

    private static long indexOf(ByteReader reader, String marker, int limit) {
        int end = Math.min(reader.length() - marker.length(), limit);
        for (int i = 0; i <= end; i++) {
            if (reader.ascii(i, marker.length()).equals(marker)) {
                return i;
            }
        }
        return -1;
    }

    private static long indexOfId(byte[] data, int id, int width, int limit) {
        outer:
        for (int i = 4; i + width < limit; i++) {
            for (int b = 0; b < width; b++) {
                int expected = (id >>> (8 * (width - 1 - b))) & 0xFF;
                if ((data[i + b] & 0xFF) != expected) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    /** EBML variable-length size: {value, encoded length}. */
    static int[] vint(ByteReader reader, long offset) {
        int first = reader.u8(offset);
        int length = Integer.numberOfLeadingZeros(first) - 23;
        if (length < 1 || length > 8) {
            throw new MalformedStructureException("invalid EBML size at " + offset);
        }
        long value = first & (0xFF >> length);
        for (int i = 1; i < length; i++) {
            value = (value << 8) | reader.u8(offset + i);
        }
        if (value > Integer.MAX_VALUE) {
            throw new MalformedStructureException("EBML size too large at " + offset);
        }
        return new int[]{(int) value, length};
    }

    private static long readUnsigned(ByteReader reader, long offset, int length) {
        long value = 0;
        for (int i = 0; i < Math.min(length, 8); i++) {
            value = (value << 8) | reader.u8(offset + i);
        }
        return value;
    }
}
