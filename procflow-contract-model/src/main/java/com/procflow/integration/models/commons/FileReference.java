package com.procflow.integration.models.commons;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.Map;
import java.util.Optional;

/**
 * Opaque handle to a file owned by the external file store.
 * The engine only passes references around and never reads file bytes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileReference implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;

    private String name;

    private long size;

    private String contentType;

    /**
     * Accepts a {@code FileReference} or its map form (as it looks after a JSON round trip).
     */
    public static Optional<FileReference> from(Object value) {
        if (value instanceof FileReference reference) {
            return Optional.of(reference);
        }
        if (value instanceof Map<?, ?> map && map.get("id") != null && map.containsKey("contentType")) {
            Object size = map.get("size");
            return Optional.of(FileReference.builder()
                    .id(String.valueOf(map.get("id")))
                    .name(map.get("name") == null ? null : String.valueOf(map.get("name")))
                    .size(size instanceof Number number ? number.longValue() : 0L)
                    .contentType(map.get("contentType") == null ? null : String.valueOf(map.get("contentType")))
                    .build());
        }
        return Optional.empty();
    }
}
