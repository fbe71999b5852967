package com.ClaimFlow.expense_backend.service;

import com.ClaimFlow.expense_backend.config.StorageProperties;
import com.ClaimFlow.expense_backend.exception.ApiException;
import com.ClaimFlow.expense_backend.exception.ResourceNotFoundException;
import com.ClaimFlow.expense_backend.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.PathResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.UUID;

/**
 * Local-disk bill storage under {@code storage.upload-dir}/yyyy/MM. Stored paths are relative.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillStorageService {

    private static final String FIELD = "billFile";

    private final StorageProperties storageProperties;
    private final Clock clock;

    public StoredBill read(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw ValidationException.forField("expenseClaimRequest", FIELD, "Bill file is required");
        }

        String extension = getFileExtension(file.getOriginalFilename());
        if (!storageProperties.getAllowedExtensions().contains(extension)) {
            throw ValidationException.forField("expenseClaimRequest", FIELD,
                    "File type not allowed. Allowed types: " + String.join(", ", storageProperties.getAllowedExtensions()));
        }

        long maxBytes = storageProperties.getMaxFileSizeMb() * 1024 * 1024;
        if (file.getSize() > maxBytes) {
            throw ValidationException.forField("expenseClaimRequest", FIELD,
                    "File size exceeds " + storageProperties.getMaxFileSizeMb() + "MB limit");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            log.error("Failed to read uploaded bill: {}", e.getMessage(), e);
            throw new ApiException("Failed to read uploaded file", HttpStatus.INTERNAL_SERVER_ERROR,
                    "INTERNAL_SERVER_ERROR", e);
        }

        return new StoredBill(content, file.getOriginalFilename(), getContentType(extension), sha256(content));
    }

    /**
     * @return path relative to the upload root
     */
    public String save(StoredBill bill) {
        LocalDate today = LocalDate.now(clock);
        String subDirectory = String.format("%d/%02d", today.getYear(), today.getMonthValue());
        String uniqueFilename = UUID.randomUUID() + "." + getFileExtension(bill.getOriginalFileName());

        try {
            Path uploadPath = root().resolve(subDirectory);
            Files.createDirectories(uploadPath);
            Files.write(uploadPath.resolve(uniqueFilename), bill.getContent());
        } catch (IOException e) {
            log.error("Failed to save bill: {}", e.getMessage(), e);
            throw new ApiException("Failed to save file", HttpStatus.INTERNAL_SERVER_ERROR,
                    "INTERNAL_SERVER_ERROR", e);
        }

        String relativePath = subDirectory + "/" + uniqueFilename;
        log.info("Bill stored at {}", relativePath);
        return relativePath;
    }

    public Resource load(String relativePath) {
        Path path = resolveInsideRoot(relativePath);
        if (!Files.exists(path)) {
            throw new ResourceNotFoundException("Bill file", "path", relativePath);
        }
        return new PathResource(path);
    }

    public void delete(String relativePath) {
        if (relativePath == null) {
            return;
        }
        try {
            if (Files.deleteIfExists(resolveInsideRoot(relativePath))) {
                log.info("Bill deleted: {}", relativePath);
            }
        } catch (IOException e) {
            // the claim row is already gone; an orphaned file is only logged
            log.error("Failed to delete bill {}: {}", relativePath, e.getMessage(), e);
        }
    }

    private Path root() {
        return Paths.get(storageProperties.getUploadDir()).toAbsolutePath().normalize();
    }

    private Path resolveInsideRoot(String relativePath) {
        Path root = root();
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new ValidationException("Invalid bill path");
        }
        return resolved;
    }

    static String sha256(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String getFileExtension(String filename) {
        if (filename == null || filename.lastIndexOf('.') == -1) {
            return "";
        }
        return filename.substring(filename.lastIndexOf('.') + 1).toLowerCase();
    }

    static String getContentType(String extension) {
        return switch (extension) {
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            case "pdf" -> "application/pdf";
            default -> "application/octet-stream";
        };
    }
}
