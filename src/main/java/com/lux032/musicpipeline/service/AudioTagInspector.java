package com.lux032.musicpipeline.service;

import lombok.extern.slf4j.Slf4j;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.jaudiotagger.tag.images.Artwork;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 读取音频文件内嵌标签(封面、歌词)
 * 读取失败一律按"没有"处理
 */
@Slf4j
public class AudioTagInspector {

    public Optional<byte[]> embeddedArtwork(Path audioFile) {
        try {
            AudioFile audioFileObj = AudioFileIO.read(audioFile.toFile());
            Tag tag = audioFileObj.getTag();

            if (tag != null) {
                Artwork artwork = tag.getFirstArtwork();
                if (artwork != null) {
                    byte[] imageData = artwork.getBinaryData();
                    if (imageData != null && imageData.length > 0) {
                        return Optional.of(imageData);
                    }
                }
            }
        } catch (Exception e) {
            log.debug("从音频文件提取封面失败: {} - {}", audioFile.getFileName(), e.getMessage());
        }
        return Optional.empty();
    }

    public boolean hasLyrics(Path audioFile) {
        try {
            AudioFile audioFileObj = AudioFileIO.read(audioFile.toFile());
            Tag tag = audioFileObj.getTag();
            if (tag == null) {
                return false;
            }
            String lyrics = tag.getFirst(FieldKey.LYRICS);
            return lyrics != null && !lyrics.trim().isEmpty();
        } catch (Exception e) {
            log.debug("检查歌词标签失败: {} - {}", audioFile.getFileName(), e.getMessage());
            return false;
        }
    }
}
