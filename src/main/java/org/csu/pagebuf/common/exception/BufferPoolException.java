package org.csu.pagebuf.common.exception;

/**
 * 缓冲池各类错误的公共父类。
 */
public class BufferPoolException extends RuntimeException {
    public BufferPoolException(String message) {
        super(message);
    }
}
