package com.agentflow.fgc.emit;

/**
 * One generated file.
 *
 * @param path     path relative to the output directory, '/'-separated
 * @param fileType {@code source}, {@code manifest}, {@code config} or {@code env}
 */
public record EmittedFile(String path, String content, String fileType) {
}
