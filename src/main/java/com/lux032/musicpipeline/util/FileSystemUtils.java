package com.lux032.musicpipeline.util;

import com.lux032.musicpipeline.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文件系统工具类
 * 负责音频文件识别、目录遍历和原子写入
 */
@Slf4j
public class FileSystemUtils {

    // 临时文件默认 0600，改名后沿用；写出的封面需要对其他用户可读
    private static final Set<PosixFilePermission> PUBLISHED_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private final Set<String> audioExtensions;

    public FileSystemUtils(PipelineConfig config) {
        this(config.getSupportedFormats());
    }

    public FileSystemUtils(String[] supportedFormats) {
        this.audioExtensions = Arrays.stream(supportedFormats)
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
    }

    /**
     * 是否为支持格式的音频文件(只看扩展名)
     */
    public boolean isAudioFile(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && audioExtensions.contains(name.substring(dot + 1));
    }

    /**
     * 目录树中是否含有音频文件，读取失败时按含有处理(避免误删)
     */
    public boolean hasAudioFiles(Path directory) {
        try (Stream<Path> stream = Files.walk(directory)) {
            return stream.anyMatch(p -> Files.isRegularFile(p) && isAudioFile(p));
        } catch (IOException | RuntimeException e) {
            log.debug("扫描目录失败: {} - {}", directory, e.getMessage());
            return true;
        }
    }

    /**
     * 递归列出音频文件，按路径排序，顶层文件优先
     */
    public List<Path> listAudioFiles(Path directory, int limit) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return result;
        }
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.filter(p -> Files.isRegularFile(p) && isAudioFile(p) && !isHidden(directory, p))
                .sorted(Comparator.comparingInt(Path::getNameCount).thenComparing(Comparator.naturalOrder()))
                .limit(limit <= 0 ? Long.MAX_VALUE : limit)
                .forEach(result::add);
        } catch (IOException | RuntimeException e) {
            log.warn("列出音频文件失败: {} - {}", directory, e.getMessage());
        }
        return result;
    }

    /**
     * 先写临时文件再原子重命名，读者不会看到写了一半的文件
     */
    public static void writeAtomically(Path target, byte[] data) throws IOException {
        Path directory = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(directory, ".cover_tmp_", ".tmp");
        try {
            Files.write(temp, data);
            if (Files.getFileStore(temp).supportsFileAttributeView(PosixFileAttributeView.class)) {
                Files.setPosixFilePermissions(temp, PUBLISHED_PERMISSIONS);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * 相对 root 的任一路径段以 . 或 ~ 开头
     */
    public static boolean isHidden(Path root, Path path) {
        Path relative = root.relativize(path);
        for (Path part : relative) {
            String name = part.toString();
            if (name.startsWith(".") || name.startsWith("~")) {
                return true;
            }
        }
        return false;
    }

    /**
     * 格式化文件大小
     */
    public static String formatSize(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"KB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024.0;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }
}
