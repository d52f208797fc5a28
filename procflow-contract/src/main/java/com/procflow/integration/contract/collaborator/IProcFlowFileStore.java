package com.procflow.integration.contract.collaborator;

import com.procflow.integration.models.commons.FileReference;
import reactor.core.publisher.Mono;

/**
 * External file storage. The engine only handles {@link FileReference}s; bytes flow
 * between collaborators.
 */
public interface IProcFlowFileStore {

    Mono<FileReference> upload(byte[] bytes, String name, String contentType);

    Mono<byte[]> read(FileReference reference);
}
