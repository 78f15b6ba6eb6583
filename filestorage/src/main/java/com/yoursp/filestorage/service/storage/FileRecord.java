package com.yoursp.filestorage.service.storage;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * A key-addressed file: the key plus its raw content.
 * Built by callers or by {@link StorageAdapter#init(String, boolean)},
 * mutated by callers before save.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {

    private String key;
    private byte[] content;

    /** Set by the adapter when the record is persisted or loaded; null before that. */
    private Instant lastModified;

    public FileRecord(String key, byte[] content) {
        this(key, content, null);
    }

    public boolean hasContent() {
        return content != null && content.length > 0;
    }

    public int size() {
        return content == null ? 0 : content.length;
    }

    /** Copy with its own content array, so stored state is never shared with callers. */
    public FileRecord copy() {
        return new FileRecord(key, content == null ? null : content.clone(), lastModified);
    }
}
