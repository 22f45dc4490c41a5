package com.example.riskscan_backend.config;

import com.example.riskscan_backend.engine.FfmpegAudioExtractor;
import com.example.riskscan_backend.engine.FfmpegFrameExtractor;
import com.example.riskscan_backend.engine.FfprobeMediaProbe;
import com.example.riskscan_backend.engine.Interfaces.AudioExtractor;
import com.example.riskscan_backend.engine.Interfaces.FrameExtractor;
import com.example.riskscan_backend.engine.Interfaces.MediaProbe;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({IngestProperties.class, EvidenceProperties.class, FusionProperties.class})
public class MediaToolsConfig {

    @Bean
    MediaProbe mediaProbe(@Value("${ffprobe.binary:ffprobe}") String ffprobe, ObjectMapper om) {
        return new FfprobeMediaProbe(ffprobe, om);
    }

    @Bean
    AudioExtractor audioExtractor(@Value("${ffmpeg.binary:ffmpeg}") String ffmpeg) {
        return new FfmpegAudioExtractor(ffmpeg);
    }

    @Bean
    FrameExtractor frameExtractor(@Value("${ffmpeg.binary:ffmpeg}") String ffmpeg, EvidenceProperties props) {
        return new FfmpegFrameExtractor(ffmpeg, props.getFrameQuality());
    }
}
