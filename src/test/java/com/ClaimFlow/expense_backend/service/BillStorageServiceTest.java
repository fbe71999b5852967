package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.StorageProperties;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.Resource;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BillStorageServiceTest {

    @TempDir
    Path uploadRoot;

    private BillStorageService storage;

    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setUploadDir(uploadRoot.toString());
        properties.setMaxFileSizeMb(1);
        Clock clock = Clock.fixed(Instant.parse("2024-06-03T06:30:00Z"), ZoneId.of("Asia/Kolkata"));
        storage = new BillStorageService(properties, clock);
    }

    @Test
    void readHashesContentAndResolvesContentType() {
        MockMultipartFile file = new MockMultipartFile("billFile", "Receipt.JPG", "application/octet-stream",
                "abc".getBytes(StandardCharsets.UTF_8));

        StoredBill bill = storage.read(file);

        assertThat(bill.getContentType()).isEqualTo("image/jpeg");
        assertThat(bill.getOriginalFileName()).isEqualTo("Receipt.JPG");
        assertThat(bill.getSha256()).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void rejectsMissingWrongTypeAndOversizedFiles() {
        assertThatThrownBy(() -> storage.read(null)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.read(new MockMultipartFile("billFile", "bill.pdf", "application/pdf", new byte[0])))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> storage.read(new MockMultipartFile("billFile", "bill.exe", "application/octet-stream", new byte[]{1})))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("File type not allowed");
        assertThatThrownBy(() -> storage.read(new MockMultipartFile("billFile", "bill.pdf", "application/pdf",
                new byte[1024 * 1024 + 1])))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("1MB");
    }

    @Test
    void saveLoadDeleteRoundTrip() throws Exception {
        StoredBill bill = storage.read(new MockMultipartFile("billFile", "ticket.pdf", "application/pdf",
                "%PDF".getBytes(StandardCharsets.UTF_8)));

        String path = storage.save(bill);

        assertThat(path).startsWith("2024/06/").endsWith(".pdf");
        Resource resource = storage.load(path);
        assertThat(resource.getContentAsByteArray()).isEqualTo(bill.getContent());

        storage.delete(path);
        assertThat(Files.exists(uploadRoot.resolve(path))).isFalse();
        assertThatThrownBy(() -> storage.load(path)).isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void pathsOutsideTheUploadRootAreRefused() {
        assertThatThrownBy(() -> storage.load("../../etc/passwd")).isInstanceOf(ValidationException.class);
    }
}
