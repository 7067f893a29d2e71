package org.csu.pagebuf.common.exception;

import lombok.Getter;

/**
 * 对 pin 计数已经为 0 的页再次 unpin，通常是调用方重复释放。
 */
@Getter
public class PageNotPinnedException extends BufferPoolException {
    private final String fileName;
    private final int pageNum;
    private final int frameNo;

    public PageNotPinnedException(String fileName, int pageNum, int frameNo) {
        super(String.format("Page %d of file '%s' in frame %d is not pinned", pageNum, fileName, frameNo));
        this.fileName = fileName;
        this.pageNum = pageNum;
        this.frameNo = frameNo;
    }
}
