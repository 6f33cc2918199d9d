package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.ContentSignals;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.IsoBmff;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Audio metadata: PCM containers through {@code javax.sound}, MP3 (ID3v2 tags and the
 * first frame header), FLAC STREAMINFO and Vorbis comments, and Ogg codec headers.
 */
public class AudioProcessor implements Processor {

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".wav", ".aif", ".aiff", ".au", ".snd", ".mp3", ".flac", ".ogg", ".oga", ".opus", ".m4a"),
            Set.of("audio/*"),
            List.of(MagicBytes.WAVE, MagicBytes.FORM, MagicBytes.AU, MagicBytes.ID3, MagicBytes.MPEG_FRAME,
                    MagicBytes.FLAC, MagicBytes.OGG));

    private static final Map<String, String> ID3_FRAMES = Map.of(
            "TIT2", "title", "TPE1", "artist", "TALB", "album", "TYER", "year",
            "TDRC", "year", "TCON", "genre", "COMM", "comment");

    private static final int[] MPEG1_L3_KBPS = {0, 32, 40, 48, 56, 64, 80, 96, 112, 128, 160, 192, 224, 256, 320};
    private static final int[] MPEG2_L3_KBPS = {0, 8, 16, 24, 32, 40, 48, 56, 64, 80, 96, 112, 128, 144, 160};
    private static final int[][] SAMPLE_RATES = {
            {11025, 12000, 8000},   // MPEG 2.5
            {0, 0, 0},
            {22050, 24000, 16000},  // MPEG 2
            {44100, 48000, 32000}}; // MPEG 1

    private static final int MAX_TAG_VALUE = 1024;

    @Override
    public String id() {
        return "audio";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) throws IOException {
        var result = ProcessingResult.builder("audio");
        byte[] data = artifact.data();
        result.metadata("size", data.length);
        var tags = new LinkedHashMap<String, String>();
        try {
            if (MagicBytes.ID3.matches(data) || MagicBytes.MPEG_FRAME.matches(data) || ".mp3".equals(artifact.extension())) {
                describeMp3(new ByteReader(data), result, tags);
            } else if (MagicBytes.FLAC.matches(data)) {
                describeFlac(new ByteReader(data), result, tags);
            } else if (MagicBytes.OGG.matches(data)) {
                describeOgg(new ByteReader(data), result);
            } else if (MagicBytes.FTYP.matches(data)) {
                IsoBmff.Summary summary = IsoBmff.parse(data);
                result.metadata("format", "m4a").metadata(summary.asMetadata());
                result.content(describe("m4a", summary.durationSeconds(), null, null));
            } else {
                describeSampled(data, result);
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed audio header: " + e.getMessage());
            result.content("Malformed audio stream");
        }

        if (!tags.isEmpty()) {
            result.metadata("tags", tags);
            Findings.reportAll(result, ContentSignals.scan(String.join("\n", tags.values())));
        }
        return result.build();
    }

    private void describeSampled(byte[] data, ProcessingResult.Builder result) throws IOException {
        AudioFileFormat fileFormat;
        try {
            fileFormat = AudioSystem.getAudioFileFormat(new BufferedInputStream(new ByteArrayInputStream(data)));
        } catch (UnsupportedAudioFileException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "audio container not recognized");
            result.error("Unsupported audio format", "UNSUPPORTED_FORMAT");
            return;
        }
        AudioFormat format = fileFormat.getFormat();
        String type = fileFormat.getType().toString().toLowerCase(Locale.ROOT);
        Double seconds = null;
        if (fileFormat.getFrameLength() != AudioSystem.NOT_SPECIFIED && format.getFrameRate() > 0) {
            seconds = Math.round(fileFormat.getFrameLength() / (double) format.getFrameRate() * 1000) / 1000.0;
            result.metadata("duration_seconds", seconds);
        }
        result.metadata("format", type)
                .metadata("encoding", format.getEncoding().toString())
                .metadata("sample_rate", Math.round(format.getSampleRate()))
                .metadata("channels", format.getChannels())
                .metadata("bits_per_sample", format.getSampleSizeInBits())
                .content(describe(type, seconds, Math.round(format.getSampleRate()), format.getChannels()));
    }

    private void describeMp3(ByteReader reader, ProcessingResult.Builder result, Map<String, String> tags) {
        long audioStart = 0;
        result.metadata("format", "mp3");
        if (reader.has(0, 10) && "ID3".equals(reader.ascii(0, 3))) {
            int major = reader.u8(3);
            long tagSize = synchsafe(reader, 6);
            audioStart = 10 + tagSize;
            result.metadata("id3_version", "2." + major);
            readId3Frames(reader, major, Math.min(audioStart, reader.length()), tags);
        }

        long frame = findFrameSync(reader, audioStart, 64 * 1024);
        if (frame < 0) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "no MPEG audio frame found");
            result.content("MP3 without audio frames");
            return;
        }
        int header = (int) reader.u32be(frame);
        int version = (header >>> 19) & 0x3;
        int layer = (header >>> 17) & 0x3;
        int bitrateIndex = (header >>> 12) & 0xF;
        int rateIndex = (header >>> 10) & 0x3;
        int channelMode = (header >>> 6) & 0x3;
        if (layer != 1 || bitrateIndex == 0xF || rateIndex == 3 || version == 1) {
            result.metadata("layer", 4 - layer).content("MPEG audio (layer " + (4 - layer) + ")");
            return;
        }
        int kbps = (version == 3 ? MPEG1_L3_KBPS : MPEG2_L3_KBPS)[bitrateIndex];
        int sampleRate = SAMPLE_RATES[version][rateIndex];
        int channels = channelMode == 3 ? 1 : 2;
        Double seconds = null;
        if (kbps > 0) {
            seconds = Math.round((reader.length() - frame) * 8.0 / (kbps * 1000.0) * 1000) / 1000.0;
            result.metadata("duration_seconds", seconds);
        }
        result.metadata("bitrate_kbps", kbps)
                .metadata("sample_rate", sampleRate)
                .metadata("channels", channels)
                .content(describe("mp3", seconds, sampleRate, channels) + ", " + kbps + " kbps");
    }

    private void readId3Frames(ByteReader reader, int major, long end, Map<String, String> tags) {
        long offset = 10;
        while (offset + 10 <= end && tags.size() < 32) {
            String id = reader.ascii(offset, 4);
            if (id.charAt(0) == 0) {
                break;
            }
            long size = major >= 4 ? synchsafe(reader, offset + 4) : reader.u32be(offset + 4);
            long body = offset + 10;
            if (size <= 0 || body + size > end) {
                break;
            }
            String key = ID3_FRAMES.get(id);
            if (key != null) {
                int length = (int) Math.min(size, MAX_TAG_VALUE);
                byte[] raw = reader.slice(body, length);
                String value = decodeId3Text(raw, "COMM".equals(id) ? 4 : 1);
                if (!value.isBlank()) {
                    tags.putIfAbsent(key, value);
                }
            }
            offset = body + size;
        }
    }

    static String decodeId3Text(byte[] raw, int skip) {
        if (raw.length <= skip) {
            return "";
        }
        Charset charset = switch (raw[0]) {
            case 1 -> StandardCharsets.UTF_16;
            case 2 -> StandardCharsets.UTF_16BE;
            case 3 -> StandardCharsets.UTF_8;
            default -> StandardCharsets.ISO_8859_1;
        };
        return new String(raw, skip, raw.length - skip, charset).replace("\0", " ").strip();
    }

    private static long findFrameSync(ByteReader reader, long from, int window) {
        long end = Math.min(reader.length() - 4L, from + window);
        for (long i = from; i <= end; i++) {
            if (reader.u8(i) == 0xFF && (reader.u8(i + 1) & 0xE0) == 0xE0) {
                return i;
            }
        }
        return -1;
    }

    private static long synchsafe(ByteReader reader, long offset) {
        return (long) (reader.u8(offset) & 0x7F) << 21 | (reader.u8(offset + 1) & 0x7F) << 14
                | (reader.u8(offset + 2) & 0x7F) << 7 | (reader.u8(offset + 3) & 0x7F);
    }

    private void describeFlac(ByteReader reader, ProcessingResult.Builder result, Map<String, String> tags) {
        result.metadata("format", "flac");
        long offset = 4;
        Double seconds = null;
        Integer sampleRate = null;
        Integer channels = null;
        for (int blocks = 0; blocks < 128 && reader.has(offset, 4); blocks++) {
            int blockHeader = reader.u8(offset);
            boolean last = (blockHeader & 0x80) != 0;
            int type = blockHeader & 0x7F;
            long length = (long) reader.u8(offset + 1) << 16 | reader.u8(offset + 2) << 8 | reader.u8(offset + 3);
            long body = offset + 4;
            if (type == 0) {
                sampleRate = reader.u8(body + 10) << 12 | reader.u8(body + 11) << 4 | reader.u8(body + 12) >> 4;
                channels = ((reader.u8(body + 12) >> 1) & 0x7) + 1;
                int bits = (((reader.u8(body + 12) & 0x1) << 4) | (reader.u8(body + 13) >> 4)) + 1;
                long samples = (long) (reader.u8(body + 13) & 0xF) << 32 | reader.u32be(body + 14);
                result.metadata("sample_rate", sampleRate)
                        .metadata("channels", channels)
                        .metadata("bits_per_sample", bits)
                        .metadata("total_samples", samples);
                if (sampleRate > 0) {
                    seconds = Math.round(samples * 1000.0 / sampleRate) / 1000.0;
                    result.metadata("duration_seconds", seconds);
                }
            } else if (type == 4) {
                readVorbisComments(reader, body, body + length, tags);
            }
            offset = body + length;
            if (last) {
                break;
            }
        }
        result.content(describe("flac", seconds, sampleRate, channels));
    }

    private static void readVorbisComments(ByteReader reader, long offset, long end, Map<String, String> tags) {
        long vendorLength = reader.u32le(offset);
        long p = offset + 4 + vendorLength;
        long count = reader.u32le(p);
        p += 4;
        for (long i = 0; i < count && i < 64 && p + 4 <= end; i++) {
            long length = reader.u32le(p);
            if (p + 4 + length > end) {
                break;
            }
            String comment = new String(reader.slice(p + 4, (int) Math.min(length, MAX_TAG_VALUE)),
                    StandardCharsets.UTF_8);
            int eq = comment.indexOf('=');
            if (eq > 0) {
                tags.putIfAbsent(comment.substring(0, eq).toLowerCase(Locale.ROOT), comment.substring(eq + 1));
            }
            p += 4 + length;
        }
    }

    private void describeOgg(ByteReader reader, ProcessingResult.Builder result) {
        int segments = reader.u8(26);
        long packet = 27L + segments;
        if (reader.has(packet, 7) && reader.u8(packet) == 1 && "vorbis".equals(reader.ascii(packet + 1, 6))) {
            int channels = reader.u8(packet + 11);
            int sampleRate = (int) reader.u32le(packet + 12);
            result.metadata("format", "ogg/vorbis").metadata("channels", channels)
                    .metadata("sample_rate", sampleRate)
                    .content(describe("ogg/vorbis", null, sampleRate, channels));
        } else if (reader.has(packet, 8) && "OpusHead".equals(reader.ascii(packet, 8))) {
            int channels = reader.u8(packet + 9);
            int sampleRate = (int) reader.u32le(packet + 12);
            result.metadata("format", "ogg/opus").metadata("channels", channels)
                    .metadata("sample_rate", sampleRate)
                    .content(describe("ogg/opus", null, sampleRate, channels));
        } else {
            result.metadata("format", "ogg").content("Ogg stream with unrecognized codec");
        }
    }

    private static String describe(String format, Double seconds, Number sampleRate, Integer channels) {
        var text = new StringBuilder("Audio: ").append(format);
        if (seconds != null) {
            long whole = (long) Math.floor(seconds);
            text.append(", ").append(String.format(Locale.ROOT, "%d:%02d", whole / 60, whole % 60));
        }
        if (sampleRate != null) {
            text.append(", ").append(sampleRate).append(" Hz");
        }
        if (channels != null) {
            text.append(channels == 1 ? " mono" : channels == 2 ? " stereo" : " " + channels + " channels");
        }
        return text.toString();
    }
}
