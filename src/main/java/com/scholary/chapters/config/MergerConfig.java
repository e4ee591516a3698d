package com.scholary.chapters.config;

import com.scholary.chapters.ffmpeg.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the merge pipeline.
 *
 * <p>Enables MergerProperties and FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({MergerProperties.class, FfmpegProperties.class})
public class MergerConfig {}
