package com.sentinel.scanner.evidence;

import com.sentinel.scanner.models.Evidence;
import com.sentinel.scanner.util.EntropyCalculator;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * Извлечение признаков файла за один проход чтения:
 * SHA-256, опционально MD5, гистограмма байтов для энтропии и ограниченный префикс содержимого.
 *
 * <p>Файл читается блоками фиксированного размера, целиком в память не загружается.
 * Либо возвращается полностью заполненный {@link Evidence}, либо выбрасывается {@link IOException}.
 * Единственное место в проекте, где считаются дайджесты.
 */
@Slf4j
public class EvidenceExtractor {

    public static final int DEFAULT_CONTENT_SAMPLE_BYTES = 256 * 1024;
    public static final int DEFAULT_READ_CHUNK_BYTES = 4096;

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final int contentSampleBytes;
    private final int readChunkBytes;

    public EvidenceExtractor() {
        this(DEFAULT_CONTENT_SAMPLE_BYTES, DEFAULT_READ_CHUNK_BYTES);
    }

    public EvidenceExtractor(int contentSampleBytes, int readChunkBytes) {
        if (readChunkBytes <= 0) {
            throw new IllegalArgumentException("readChunkBytes должен быть > 0");
        }
        this.contentSampleBytes = Math.max(0, contentSampleBytes);
        this.readChunkBytes = readChunkBytes;
    }

    /**
     * Извлечь признаки файла
     *
     * @param path путь к обычному файлу
     * @param legacyDigest считать ли MD5 для сигнатур старого формата
     * @throws IOException файл недоступен или чтение прервано
     */
    public Evidence extract(Path path, boolean legacyDigest) throws IOException {
        MessageDigest sha256 = newDigest("SHA-256");
        MessageDigest md5 = legacyDigest ? newDigest("MD5") : null;
        EntropyCalculator entropy = new EntropyCalculator();
        ByteArrayOutputStream sample = new ByteArrayOutputStream(Math.min(contentSampleBytes, 64 * 1024));

        byte[] buffer = new byte[readChunkBytes];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new IOException("Чтение прервано: " + path);
                }
                sha256.update(buffer, 0, read);
                if (md5 != null) {
                    md5.update(buffer, 0, read);
                }
                entropy.update(buffer, 0, read);
                int room = contentSampleBytes - sample.size();
                if (room > 0) {
                    sample.write(buffer, 0, Math.min(room, read));
                }
            }
        }

        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        Evidence evidence = Evidence.builder()
            .path(path)
            .fileName(fileName)
            .sizeBytes(entropy.getTotal())
            .extension(extensionOf(fileName))
            .sha256(toHex(sha256.digest()))
            .md5(md5 != null ? toHex(md5.digest()) : null)
            .entropy(entropy.entropy())
            .contentSample(sample.toByteArray())
            .hidden(isHidden(path))
            .worldWritable(isWorldWritable(path))
            .createdAt(Instant.now())
            .build();

        log.debug("Признаки {}: {} байт, энтропия {}", path, evidence.getSizeBytes(),
            String.format(Locale.ROOT, "%.3f", evidence.getEntropy()));
        return evidence;
    }

    /**
     * Расширение в нижнем регистре с точкой; у ".profile" расширения нет
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    private static boolean isHidden(Path path) {
        try {
            return Files.isHidden(path);
        } catch (IOException e) {
            Path name = path.getFileName();
            return name != null && name.toString().startsWith(".");
        }
    }

    private static boolean isWorldWritable(Path path) throws IOException {
        // права цели: решение идти ли по ссылке уже принято обходом
        PosixFileAttributeView view = Files.getFileAttributeView(path, PosixFileAttributeView.class);
        if (view == null) {
            return false;
        }
        Set<PosixFilePermission> permissions = view.readAttributes().permissions();
        return permissions.contains(PosixFilePermission.OTHERS_WRITE);
    }

    private static MessageDigest newDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Алгоритм " + algorithm + " недоступен", e);
        }
    }

    static String toHex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
