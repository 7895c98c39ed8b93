package org.codesync.web;

import jakarta.servlet.http.HttpServletRequest;
import org.codesync.sync.UploadCapabilityIssuer;
import org.codesync.sync.WorkspaceSyncProperties;
import org.codesync.sync.blob.BlobInfo;
import org.codesync.sync.blob.BlobStore;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.NoSuchFileException;

/**
 * 对象存储的凭证访问入口：只开放 PUT（上传）与 GET（下载），删除不对客户端开放。
 */
@RestController
@RequestMapping("/blobs")
public class BlobController {

    private final BlobStore blobStore;
    private final UploadCapabilityIssuer capabilityIssuer;
    private final WorkspaceSyncProperties properties;

    public BlobController(BlobStore blobStore, UploadCapabilityIssuer capabilityIssuer, WorkspaceSyncProperties properties) {
        this.blobStore = blobStore;
        this.capabilityIssuer = capabilityIssuer;
        this.properties = properties;
    }

    @PutMapping
    public BlobInfo upload(
            @RequestParam("key") String storageKey,
            @RequestParam(value = "sha256", required = false) String sha256,
            @RequestParam("expires") long expires,
            @RequestParam("signature") String signature,
            HttpServletRequest request
    ) throws IOException {
        capabilityIssuer.verify(UploadCapabilityIssuer.UPLOAD, storageKey, sha256, expires, signature);
        try (InputStream body = request.getInputStream()) {
            blobStore.put(storageKey, body, properties.getUploadMaxBytes().toBytes(), sha256);
        }
        return blobStore.stat(storageKey)
                .orElseThrow(() -> new NoSuchFileException(storageKey));
    }

    @GetMapping
    public ResponseEntity<InputStreamResource> download(
            @RequestParam("key") String storageKey,
            @RequestParam("expires") long expires,
            @RequestParam("signature") String signature
    ) throws IOException {
        capabilityIssuer.verify(UploadCapabilityIssuer.DOWNLOAD, storageKey, null, expires, signature);
        BlobInfo info = blobStore.stat(storageKey)
                .orElseThrow(() -> new NoSuchFileException(storageKey));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .contentLength(info.size())
                .eTag("\"" + info.sha256() + "\"")
                .body(new InputStreamResource(blobStore.open(storageKey)));
    }
}
