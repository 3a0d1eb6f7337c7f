package org.cachebust.engine.dto;

/**
 * 单个文件的改写结果。
 */
public enum FilePatchStatus {
    WRITTEN,
    PREVIEW,
    SKIPPED_MODIFIED,
    SKIPPED_INTERRUPTED,
    FAILED
}
