package com.quadscan.core.frame;

/**
 * 帧源读取失败。对整个管道是致命错误，不做重试。
 */
public class SourceReadException extends RuntimeException {

    private final long position;

    public SourceReadException(String message, long position) {
        super(message);
        this.position = position;
    }

    public SourceReadException(String message, long position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    public long getPosition() {
        return position;
    }
}
