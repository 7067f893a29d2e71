package org.csu.pagebuf.common.exception;

import lombok.Getter;

/**
 * flush 或 dispose 时遇到仍被 pin 住的页。
 */
@Getter
public class PagePinnedException extends BufferPoolException {
    private final String fileName;
    private final int pageNum;
    private final int frameNo;

    public PagePinnedException(String fileName, int pageNum, int frameNo) {
        super(String.format("Page %d of file '%s' is still pinned in frame %d", pageNum, fileName, frameNo));
        this.fileName = fileName;
        this.pageNum = pageNum;
        this.frameNo = frameNo;
    }
}
