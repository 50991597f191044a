package com.lux032.musicpipeline.util;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.stream.Stream;

class FileSystemUtilsTest {

    @TempDir
    Path tempDir;

    private final FileSystemUtils fileSystemUtils = new FileSystemUtils(new String[]{"FLAC", "mp3"});

    @Test
    void shouldRecognizeAudioByExtensionIgnoringCase() {
        Assertions.assertTrue(fileSystemUtils.isAudioFile(Paths.get("/a/01.flac")));
        Assertions.assertTrue(fileSystemUtils.isAudioFile(Paths.get("/a/01.MP3")));
        Assertions.assertFalse(fileSystemUtils.isAudioFile(Paths.get("/a/cover.jpg")));
        Assertions.assertFalse(fileSystemUtils.isAudioFile(Paths.get("/a/flac")));
    }

    @Test
    void shouldListTopLevelAudioFirst() throws Exception {
        Files.createDirectories(tempDir.resolve("CD1"));
        Files.write(tempDir.resolve("CD1/01.flac"), new byte[]{1});
        Files.write(tempDir.resolve("b.flac"), new byte[]{1});
        Files.write(tempDir.resolve("a.mp3"), new byte[]{1});
        Files.write(tempDir.resolve(".hidden.flac"), new byte[]{1});

        List<Path> files = fileSystemUtils.listAudioFiles(tempDir, 2);

        Assertions.assertEquals(List.of(tempDir.resolve("a.mp3"), tempDir.resolve("b.flac")), files);
        Assertions.assertEquals(3, fileSystemUtils.listAudioFiles(tempDir, 0).size());
    }

    @Test
    void shouldReplaceTargetAtomicallyWithoutLeavingTempFiles() throws Exception {
        Path target = tempDir.resolve("cover.jpg");
        Files.write(target, new byte[]{1});

        FileSystemUtils.writeAtomically(target, new byte[]{7, 7});

        Assertions.assertArrayEquals(new byte[]{7, 7}, Files.readAllBytes(target));
        try (Stream<Path> files = Files.list(tempDir)) {
            Assertions.assertEquals(1, files.count());
        }
    }

    @Test
    void shouldWriteFilesReadableByOtherUsers() throws Exception {
        Assumptions.assumeTrue(Files.getFileStore(tempDir).supportsFileAttributeView(PosixFileAttributeView.class));
        Path target = tempDir.resolve("cover.jpg");

        FileSystemUtils.writeAtomically(target, new byte[]{1, 2});

        Assertions.assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
    }

    @Test
    void shouldTreatDotAndTildeSegmentsAsHidden() {
        Path root = Paths.get("/music");
        Assertions.assertTrue(FileSystemUtils.isHidden(root, Paths.get("/music/.beets/state")));
        Assertions.assertTrue(FileSystemUtils.isHidden(root, Paths.get("/music/A/~lock.flac")));
        Assertions.assertFalse(FileSystemUtils.isHidden(root, Paths.get("/music/A/B.flac")));
    }

    @Test
    void shouldFormatSizes() {
        Assertions.assertEquals("512 B", FileSystemUtils.formatSize(512));
        Assertions.assertEquals("1.5 KB", FileSystemUtils.formatSize(1536));
        Assertions.assertEquals("2.0 GB", FileSystemUtils.formatSize(2L * 1024 * 1024 * 1024));
    }
}
