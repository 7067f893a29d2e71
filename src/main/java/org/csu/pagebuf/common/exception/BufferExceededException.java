package org.csu.pagebuf.common.exception;

/**
 * 时钟指针转满一圈仍找不到可替换的帧：所有帧都被 pin 住了。
 * 调用方需要先释放一些页，或者换一个更大的缓冲池。
 */
public class BufferExceededException extends BufferPoolException {
    public BufferExceededException(int numBufs) {
        super(String.format("Buffer pool exceeded: no evictable frame among %d frames", numBufs));
    }
}
