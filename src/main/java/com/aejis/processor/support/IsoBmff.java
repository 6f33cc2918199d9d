package com.aejis.processor.support;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Box walker for ISO base media files (MP4, MOV, M4A, 3GP).
 */
public final class IsoBmff {

    private static final Set<String> CONTAINERS = Set.of("moov", "trak", "mdia", "minf", "stbl", "udta", "edts");
    private static final int MAX_BOXES = 10_000;
    private static final int MAX_DEPTH = 8;

    /** Seconds between 1904-01-01 and the Unix epoch. */
    public static final long MAC_EPOCH_OFFSET = 2_082_844_800L;

    public record Summary(
            String majorBrand,
            List<String> compatibleBrands,
            List<String> topLevelBoxes,
            Double durationSeconds,
            Long timescale,
            Integer width,
            Integer height,
            int trackCount,
            List<String> handlers,
            long trailingBytes) {

        public Map<String, Object> asMetadata() {
            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("major_brand", majorBrand);
            metadata.put("compatible_brands", compatibleBrands);
            metadata.put("boxes", topLevelBoxes);
            if (durationSeconds != null) {
                metadata.put("duration_seconds", durationSeconds);
            }
            if (width != null && height != null) {
                metadata.put("width", width);
                metadata.put("height", height);
                metadata.put("dimensions", width + "x" + height);
            }
            metadata.put("track_count", trackCount);
            metadata.put("track_handlers", handlers);
            return metadata;
        }
    }

    private IsoBmff() {}

    public static Summary parse(byte[] data) {
        var walker = new Walker(new ByteReader(data));
        long end = walker.walk(0, data.length, 0);
        return new Summary(walker.majorBrand, walker.brands, walker.topLevel, walker.duration,
                walker.timescale, walker.width, walker.height, walker.tracks, walker.handlers,
                Math.max(0, data.length - end));
    }

    private static final class Walker {

        private final ByteReader reader;
        private final List<String> topLevel = new ArrayList<>();
        private final List<String> brands = new ArrayList<>();
        private final List<String> handlers = new ArrayList<>();
        private String majorBrand;
        private Double duration;
        private Long timescale;
        private Integer width;
        private Integer height;
        private int tracks;
        private int boxes;

        Walker(ByteReader reader) {
            this.reader = reader;
        }

        /** Returns the offset just past the last complete box. */
        long walk(long start, long end, int depth) {
            long offset = start;
            while (offset + 8 <= end && boxes++ < MAX_BOXES) {
                long size = reader.u32be(offset);
                String type = reader.ascii(offset + 4, 4);
                long header = 8;
                if (size == 1) {
                    size = reader.u64be(offset + 8);
                    header = 16;
                } else if (size == 0) {
                    size = end - offset;
                }
                if (size < header || offset + size > end) {
                    throw new MalformedStructureException("box '" + type + "' overruns its parent at " + offset);
                }
                if (depth == 0) {
                    topLevel.add(type);
                }
                long payload = offset + header;
                long payloadEnd = offset + size;
                switch (type) {
                    case "ftyp" -> readFtyp(payload, payloadEnd);
                    case "mvhd" -> readMvhd(payload);
                    case "tkhd" -> readTkhd(payload);
                    case "hdlr" -> handlers.add(reader.ascii(payload + 8, 4));
                    case "trak" -> tracks++;
                    default -> { }
                }
                if (CONTAINERS.contains(type) && depth < MAX_DEPTH) {
                    walk(payload, payloadEnd, depth + 1);
                }
                offset = payloadEnd;
            }
            return offset;
        }

        private void readFtyp(long payload, long end) {
            majorBrand = reader.ascii(payload, 4).trim();
            for (long p = payload + 8; p + 4 <= end && brands.size() < 32; p += 4) {
                brands.add(reader.ascii(p, 4).trim());
            }
        }

        private void readMvhd(long payload) {
            int version = reader.u8(payload);
            long scale;
            long length;
            if (version == 1) {
                scale = reader.u32be(payload + 20);
                length = reader.u64be(payload + 24);
            } else {
                scale = reader.u32be(payload + 12);
                length = reader.u32be(payload + 16);
            }
            timescale = scale;
            if (scale > 0) {
                duration = Math.round(length * 1000.0 / scale) / 1000.0;
            }
        }

        private void readTkhd(long payload) {
            if (width != null) {
                return;
            }
            long base = reader.u8(payload) == 1 ? payload + 88 : payload + 76;
            int w = (int) (reader.u32be(base) >>> 16);
            int h = (int) (reader.u32be(base + 4) >>> 16);
            if (w > 0 && h > 0) {
                width = w;
                height = h;
            }
        }
    }
}
