package com.aejis.archive;

/**
 * One regular file pulled out of an archive.
 *
 * @param path   sanitized path; nested entries are written as {@code outer.zip!/inner.txt}
 * @param size   actual uncompressed size in bytes
 * @param depth  nesting level, 1 for entries of the outer archive
 * @param sample leading bytes of the content, for type detection and scanning
 */
public record ExtractedFile(String path, long size, int depth, byte[] sample) {

    public String extension() {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
