package org.codesync.sync;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HashingUtilsTest {

    @Test
    void sha256Hex_knownVector() {
        assertThat(HashingUtils.sha256Hex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sha256Hex_nullTextHashesAsEmpty() {
        assertThat(HashingUtils.sha256Hex((String) null))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
    }

    @Test
    void sha256Hex_fileMatchesBytes(@TempDir Path dir) throws Exception {
        byte[] content = "print('hello')\n".repeat(2000).getBytes(StandardCharsets.UTF_8);
        Path file = dir.resolve("main.py");
        Files.write(file, content);

        assertThat(HashingUtils.sha256Hex(file)).isEqualTo(HashingUtils.sha256Hex(content));
    }
}
