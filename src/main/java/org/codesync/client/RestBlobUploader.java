package org.codesync.client;

import org.codesync.sync.UploadFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.URI;

/**
 * 通过 HTTP PUT 直接写入对象存储。相对凭证地址按 {@code baseUri} 解析。
 */
public class RestBlobUploader implements BlobUploader {

    private final RestClient restClient;
    private final URI baseUri;

    public RestBlobUploader(RestClient restClient, URI baseUri) {
        this.restClient = restClient;
        this.baseUri = baseUri;
    }

    @Override
    public void put(String filePath, String capabilityUrl, byte[] content) {
        if (capabilityUrl == null || capabilityUrl.isBlank()) {
            throw new UploadFailureException(filePath, false, "缺少上传凭证：" + filePath, null);
        }
        URI target = baseUri.resolve(capabilityUrl);
        try {
            restClient.put()
                    .uri(target)
                    .contentType(MediaType.APPLICATION_OCTET_STREAM)
                    .body(content)
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (response.getStatusCode().is2xxSuccessful()) {
                            return null;
                        }
                        if (status == HttpStatus.GONE.value()) {
                            throw new UploadFailureException(filePath, true, "上传凭证已过期：" + filePath, null);
                        }
                        throw new UploadFailureException(filePath, false, "上传失败（HTTP " + status + "）：" + filePath, null);
                    });
        } catch (RestClientException e) {
            throw new UploadFailureException(filePath, false, "上传失败：" + filePath, e);
        }
    }
}
