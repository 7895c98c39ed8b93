package org.codesync.sync;

import org.springframework.web.util.UriComponentsBuilder;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;

/**
 * 对象存储访问凭证：带过期时间的 HMAC-SHA256 签名 URL。
 * <p>
 * 凭证只授权“对某一个对象键执行某一种操作（PUT 或 GET）”，不需要服务端再介入；
 * 删除操作不签发凭证，只能由服务端在提交后执行。
 * <p>
 * 上传凭证同时签入 sync 阶段声明的 sha256：持有者只能写入那一份内容，
 * 提交后再用同一凭证写入不同字节会被拒绝，已提交对象不会被替换。
 */
public class UploadCapabilityIssuer {

    public static final String UPLOAD = "PUT";
    public static final String DOWNLOAD = "GET";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final HexFormat HEX = HexFormat.of();

    private final byte[] secret;
    private final String publicBaseUrl;
    private final Duration uploadTtl;
    private final Duration downloadTtl;
    private final Clock clock;

    public UploadCapabilityIssuer(byte[] secret, String publicBaseUrl, Duration uploadTtl, Duration downloadTtl, Clock clock) {
        if (secret == null || secret.length < 16) {
            throw new IllegalArgumentException("凭证签名密钥至少需要 16 字节");
        }
        this.secret = secret.clone();
        this.publicBaseUrl = publicBaseUrl;
        this.uploadTtl = uploadTtl;
        this.downloadTtl = downloadTtl;
        this.clock = clock;
    }

    public Capability issueUpload(String storageKey, String contentSha256) {
        if (contentSha256 == null || contentSha256.isBlank()) {
            throw new IllegalArgumentException("上传凭证必须绑定内容哈希");
        }
        return issue(UPLOAD, storageKey, contentSha256, uploadTtl);
    }

    public Capability issueDownload(String storageKey) {
        return issue(DOWNLOAD, storageKey, null, downloadTtl);
    }

    /**
     * 校验凭证：签名错误与过期分别报告，过期时客户端应重新发起整轮同步。
     */
    public void verify(String method, String storageKey, String contentSha256, long expiresEpochSecond, String signature) {
        if (storageKey == null || signature == null) {
            throw new CapabilityRejectedException(false, "凭证缺少必要参数");
        }
        byte[] expected = sign(method, storageKey, contentSha256, expiresEpochSecond);
        byte[] actual;
        try {
            actual = HEX.parseHex(signature);
        } catch (IllegalArgumentException e) {
            throw new CapabilityRejectedException(false, "凭证签名格式错误");
        }
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new CapabilityRejectedException(false, "凭证签名无效");
        }
        if (clock.instant().isAfter(Instant.ofEpochSecond(expiresEpochSecond))) {
            throw new CapabilityRejectedException(true, "凭证已过期，请重新同步");
        }
    }

    private Capability issue(String method, String storageKey, String contentSha256, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        long expires = expiresAt.getEpochSecond();
        // 未配置对外地址时签发相对地址，由客户端按自己的服务地址解析
        UriComponentsBuilder builder = publicBaseUrl == null || publicBaseUrl.isBlank()
                ? UriComponentsBuilder.fromPath("/blobs")
                : UriComponentsBuilder.fromUriString(publicBaseUrl).path("/blobs");
        builder.queryParam("key", storageKey);
        if (contentSha256 != null) {
            builder.queryParam("sha256", contentSha256);
        }
        String url = builder
                .queryParam("expires", expires)
                .queryParam("signature", HEX.formatHex(sign(method, storageKey, contentSha256, expires)))
                .encode()
                .build()
                .toUriString();
        return new Capability(url, Instant.ofEpochSecond(expires));
    }

    private byte[] sign(String method, String storageKey, String contentSha256, long expires) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            String payload = method + "\n" + storageKey + "\n" + (contentSha256 == null ? "" : contentSha256) + "\n" + expires;
            return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("当前运行环境不支持 " + HMAC_ALGORITHM, e);
        }
    }

    /**
     * @param url       签名 URL
     * @param expiresAt 过期时间
     */
    public record Capability(String url, Instant expiresAt) {
    }
}
