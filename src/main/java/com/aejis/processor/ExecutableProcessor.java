package com.aejis.processor;

import com.aejis.core.model.ProcessingResult;
import com.aejis.core.scoring.SignalCategory;
import com.aejis.processor.support.ByteReader;
import com.aejis.processor.support.Entropy;
import com.aejis.processor.support.Findings;
import com.aejis.processor.support.Hashes;
import com.aejis.processor.support.MagicBytes;
import com.aejis.processor.support.MalformedStructureException;
import com.aejis.processor.support.PrintableStrings;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static header analysis of PE, ELF and Mach-O binaries. Nothing is ever executed; the
 * processor is isolation-sensitive so it always runs in a fresh container.
 *
 * <p>Every artifact routed here yields an {@code EXECUTABLE_CONTENT} threat indicator.
 */
public class ExecutableProcessor implements Processor {

    static final double PACKED_SECTION_ENTROPY = 7.2;
    private static final int MAX_SECTIONS = 96;

    private static final MatchCriteria CRITERIA = MatchCriteria.of(
            Set.of(".exe", ".dll", ".sys", ".scr", ".cpl", ".ocx", ".msi", ".com", ".efi",
                    ".so", ".elf", ".o", ".dylib", ".bundle"),
            Set.of("application/x-msdownload", "application/x-dosexec", "application/vnd.microsoft.portable-executable",
                    "application/x-executable", "application/x-sharedlib", "application/x-elf",
                    "application/x-mach-binary"),
            List.of(MagicBytes.MZ, MagicBytes.ELF, MagicBytes.MACHO_32, MagicBytes.MACHO_64,
                    MagicBytes.MACHO_32_LE, MagicBytes.MACHO_64_LE, MagicBytes.MACHO_FAT))
            .withPriority(10);

    /** Import names grouped by what they suggest. */
    private static final Map<String, Map.Entry<SignalCategory, String>> SUSPICIOUS_APIS = new LinkedHashMap<>();

    static {
        for (String api : List.of("VirtualAllocEx", "WriteProcessMemory", "CreateRemoteThread",
                "NtUnmapViewOfSection", "QueueUserAPC", "SetThreadContext")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.MALWARE_KEYWORD, "process injection API"));
        }
        for (String api : List.of("SetWindowsHookEx", "GetAsyncKeyState", "GetKeyboardState")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.MALWARE_KEYWORD, "keystroke capture API"));
        }
        for (String api : List.of("URLDownloadToFile", "InternetOpenUrl", "WinHttpOpen", "HttpSendRequest")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.NETWORK_EXPLOIT, "download API"));
        }
        for (String api : List.of("IsDebuggerPresent", "CheckRemoteDebuggerPresent")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.SUSPICIOUS_STRUCTURE, "anti-debugging API"));
        }
        for (String api : List.of("CryptEncrypt", "BCryptEncrypt")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.CRYPTO_ACTIVITY, "encryption API"));
        }
        for (String api : List.of("RegSetValueEx", "RegCreateKeyEx")) {
            SUSPICIOUS_APIS.put(api, Map.entry(SignalCategory.INFO, "registry write API"));
        }
    }

    private static final Map<Integer, String> PE_MACHINES = Map.of(
            0x14C, "x86", 0x8664, "x86_64", 0x1C0, "arm", 0xAA64, "arm64", 0x200, "ia64");
    private static final Map<Integer, String> ELF_MACHINES = Map.of(
            3, "x86", 62, "x86_64", 40, "arm", 183, "aarch64", 243, "riscv", 8, "mips", 20, "ppc", 21, "ppc64");
    private static final Map<Integer, String> ELF_TYPES = Map.of(
            1, "relocatable", 2, "executable", 3, "shared object", 4, "core");

    @Override
    public String id() {
        return "executable";
    }

    @Override
    public MatchCriteria criteria() {
        return CRITERIA;
    }

    @Override
    public boolean isolationSensitive() {
        return true;
    }

    @Override
    public ProcessingResult process(Artifact artifact, ProcessingContext context) {
        var result = ProcessingResult.builder("executable");
        byte[] data = artifact.data();
        var reader = new ByteReader(data);
        result.metadata("size", data.length).metadata("hashes", Hashes.all(data));

        String format;
        try {
            if (MagicBytes.MZ.matches(data)) {
                format = describePe(reader, result);
            } else if (MagicBytes.ELF.matches(data)) {
                format = describeElf(reader, result);
            } else if (MagicBytes.MACHO_FAT.matches(data)) {
                format = "Mach-O universal";
                result.metadata("architectures", reader.u32be(4));
            } else if (MagicBytes.isExecutable(data)) {
                format = describeMachO(reader, result);
            } else {
                format = null;
            }
        } catch (MalformedStructureException e) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "malformed executable header: " + e.getMessage());
            format = "malformed";
        }

        if (format == null) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE,
                    artifact.extension() + " extension without executable header");
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT,
                    "declared executable type (" + artifact.extension() + ")");
            format = "unknown";
        } else {
            Findings.report(result, SignalCategory.EXECUTABLE_CONTENT, format + " executable");
        }

        scanImports(data, result);
        double entropy = Entropy.round(Entropy.of(data));
        result.metadata("format", format).metadata("entropy", entropy);
        result.content(format + " executable, " + data.length + " bytes, entropy " + entropy);
        return result.build();
    }

    private String describePe(ByteReader reader, ProcessingResult.Builder result) {
        long peOffset = reader.u32le(0x3C);
        if (!reader.has(peOffset, 24) || !"PE\0\0".equals(reader.ascii(peOffset, 4))) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "MZ header without PE signature");
            return "DOS";
        }
        long coff = peOffset + 4;
        int machine = reader.u16le(coff);
        int sectionCount = reader.u16le(coff + 2);
        long timestamp = reader.u32le(coff + 4);
        int optionalSize = reader.u16le(coff + 16);
        int characteristics = reader.u16le(coff + 18);
        long optional = coff + 20;
        int magic = reader.u16le(optional);
        boolean pe32Plus = magic == 0x20B;
        int subsystem = reader.u16le(optional + 68);

        result.metadata("machine", PE_MACHINES.getOrDefault(machine, String.format("0x%04x", machine)))
                .metadata("pe_type", pe32Plus ? "PE32+" : "PE32")
                .metadata("dll", (characteristics & 0x2000) != 0)
                .metadata("subsystem", subsystem == 2 ? "gui" : subsystem == 3 ? "console" : String.valueOf(subsystem))
                .metadata("entry_point", String.format("0x%x", reader.u32le(optional + 16)))
                .metadata("compiled_at", Instant.ofEpochSecond(timestamp).toString());

        if (sectionCount > MAX_SECTIONS) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "implausible section count " + sectionCount);
            sectionCount = MAX_SECTIONS;
        }
        long table = optional + optionalSize;
        var sections = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < sectionCount; i++) {
            long header = table + 40L * i;
            String name = reader.cstring(header, 8);
            long rawSize = reader.u32le(header + 16);
            long rawOffset = reader.u32le(header + 20);
            long flags = reader.u32le(header + 36);
            var section = new LinkedHashMap<String, Object>();
            section.put("name", name);
            section.put("raw_size", rawSize);
            if (rawSize > 0 && reader.has(rawOffset, rawSize)) {
                double entropy = Entropy.round(Entropy.of(reader.slice(rawOffset, (int) rawSize)));
                section.put("entropy", entropy);
                if (entropy > PACKED_SECTION_ENTROPY) {
                    Findings.report(result, SignalCategory.HIGH_ENTROPY, "packed section " + name);
                }
            } else if (rawSize > 0) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "section " + name + " outside file");
            }
            if ((flags & 0x20000000L) != 0 && (flags & 0x80000000L) != 0) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "writable and executable section " + name);
            }
            if (name.startsWith("UPX")) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "UPX packer sections");
            }
            sections.add(section);
        }
        result.metadata("sections", sections);
        return pe32Plus ? "PE32+" : "PE32";
    }

    private String describeElf(ByteReader reader, ProcessingResult.Builder result) {
        boolean is64 = reader.u8(4) == 2;
        boolean little = reader.u8(5) == 1;
        int type = little ? reader.u16le(16) : reader.u16be(16);
        int machine = little ? reader.u16le(18) : reader.u16be(18);
        long entry = is64 ? (little ? reader.u64le(24) : reader.u64be(24))
                : (little ? reader.u32le(24) : reader.u32be(24));
        long sectionOffset = is64 ? (little ? reader.u64le(40) : reader.u64be(40))
                : (little ? reader.u32le(32) : reader.u32be(32));
        int entrySize = is64 ? 64 : 40;
        long countAt = is64 ? 60 : 48;
        int sectionCount = little ? reader.u16le(countAt) : reader.u16be(countAt);
        int namesIndex = little ? reader.u16le(countAt + 2) : reader.u16be(countAt + 2);

        result.metadata("class", is64 ? "ELF64" : "ELF32")
                .metadata("endianness", little ? "little" : "big")
                .metadata("type", ELF_TYPES.getOrDefault(type, String.valueOf(type)))
                .metadata("machine", ELF_MACHINES.getOrDefault(machine, String.valueOf(machine)))
                .metadata("entry_point", String.format("0x%x", entry))
                .metadata("section_count", sectionCount);

        if (sectionOffset > 0 && sectionCount > 0 && namesIndex < sectionCount) {
            if (!reader.has(sectionOffset, (long) sectionCount * entrySize)) {
                Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "ELF section table outside file");
            } else {
                long namesHeader = sectionOffset + (long) namesIndex * entrySize;
                long namesOffset = is64 ? (little ? reader.u64le(namesHeader + 24) : reader.u64be(namesHeader + 24))
                        : (little ? reader.u32le(namesHeader + 16) : reader.u32be(namesHeader + 16));
                var names = new LinkedHashSet<String>();
                for (int i = 0; i < Math.min(sectionCount, MAX_SECTIONS); i++) {
                    long header = sectionOffset + (long) i * entrySize;
                    long nameOffset = little ? reader.u32le(header) : reader.u32be(header);
                    if (reader.has(namesOffset + nameOffset, 1)) {
                        String name = reader.cstring(namesOffset + nameOffset, 64);
                        if (!name.isEmpty()) {
                            names.add(name);
                        }
                    }
                }
                result.metadata("sections", new ArrayList<>(names));
                if (names.stream().anyMatch(n -> n.startsWith("UPX"))) {
                    Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "UPX packer sections");
                }
            }
        } else if (sectionCount == 0) {
            Findings.report(result, SignalCategory.SUSPICIOUS_STRUCTURE, "ELF without section headers");
        }
        return is64 ? "ELF64" : "ELF32";
    }

    private String describeMachO(ByteReader reader, ProcessingResult.Builder result) {
        boolean little = reader.u8(0) == 0xCE || reader.u8(0) == 0xCF;
        boolean is64 = reader.u8(little ? 0 : 3) == 0xCF;
        long cpu = little ? reader.u32le(4) : reader.u32be(4);
        long fileType = little ? reader.u32le(12) : reader.u32be(12);
        long commands = little ? reader.u32le(16) : reader.u32be(16);
        result.metadata("cpu_type", cpu)
                .metadata("file_type", fileType == 2 ? "executable" : fileType == 6 ? "dylib" : String.valueOf(fileType))
                .metadata("load_commands", commands);
        return is64 ? "Mach-O 64" : "Mach-O";
    }

    private static void scanImports(byte[] data, ProcessingResult.Builder result) {
        Set<String> seen = new LinkedHashSet<>();
        for (String value : PrintableStrings.extract(data, 20_000)) {
            for (Map.Entry<String, Map.Entry<SignalCategory, String>> api : SUSPICIOUS_APIS.entrySet()) {
                if (value.startsWith(api.getKey()) && seen.add(api.getKey())) {
                    Findings.report(result, api.getValue().getKey(), api.getValue().getValue());
                }
            }
        }
        if (!seen.isEmpty()) {
            result.metadata("suspicious_imports", new ArrayList<>(seen));
        }
    }
}
